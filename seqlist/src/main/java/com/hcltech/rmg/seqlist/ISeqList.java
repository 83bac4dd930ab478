package com.hcltech.rmg.seqlist;

import com.hcltech.rmg.common.random.IRandomInts;
import com.hcltech.rmg.seqlist.sortedset.ISortedSet;

import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Resizable sequence of element references with an explicit lifecycle.
 * <p>
 * The list holds references only. It never copies or inspects elements, and null is a legal value.
 * If a destructor is registered it is run once per live element by {@link #destroy()}; nothing
 * else (set, remove, pop, reallocation) ever invokes it.
 * <p>
 * Single-threaded: callers serialise access.
 */
public interface ISeqList<T> extends Iterable<T>, AutoCloseable {

    // ---- Accessors

    int length();

    default boolean isEmpty() {
        return length() == 0;
    }

    /** @throws IndexOutOfBoundsException unless {@code 0 <= index < length()} */
    T get(int index);

    /**
     * Overwrites the slot. The previous reference is dropped without running the destructor.
     *
     * @throws IndexOutOfBoundsException unless {@code 0 <= index < length()}
     */
    void set(int index, T value);

    // ---- Growth and mutation

    void append(T value);

    /**
     * Appends every element of {@code source} in order.
     *
     * @throws IllegalArgumentException if {@code source} is this list
     */
    void appendAll(ISeqList<? extends T> source);

    /** Replaces the drop policy; null clears it. */
    void setDestructor(Consumer<? super T> destructor);

    Consumer<? super T> destructor();

    // ---- Removal (never runs the destructor; the caller receives the reference)

    T remove(int index);

    T removeFirst();

    /** @throws IllegalStateException if empty */
    T pop();

    /** Removes the lowest-index element identical ({@code ==}) to {@code value}, if any. */
    void removeItem(T value);

    /** @throws IllegalStateException if empty */
    T peek();

    // ---- Query (identity comparison)

    boolean contains(T value);

    /** @return lowest index holding a reference identical to {@code value}, or -1 */
    int indexOf(T value);

    // ---- Bulk / derived

    /** Shallow copy with {@code destructorForCopy} (nullable) registered on the copy. */
    ISeqList<T> copy(Consumer<? super T> destructorForCopy);

    void reverse();

    void sort(Comparator<? super T> comparator);

    /** Shuffles with the default random source. */
    void shuffle();

    /**
     * For each index {@code i} in order, swaps {@code i} with {@code random.nextInt(0, length())}.
     * The swap target spans the whole list at every step, so the permutation is not uniform.
     */
    void shuffle(IRandomInts random);

    /** @param comparator null means the default ordering: null first, natural order for {@link Comparable} values, identity otherwise */
    ISortedSet<T> toSortedSet(Comparator<? super T> comparator);

    ISeqList<T> filter(Predicate<? super T> predicate);

    ISeqList<T> filterToInclude(ISortedSet<T> set);

    ISeqList<T> filterToExclude(ISortedSet<T> set);

    /**
     * Moves every element into a default-ordered set, hands this list's destructor to that set
     * and destroys this list. The list must not be used afterwards.
     */
    ISortedSet<T> convertToSortedSet();

    /** Unmodifiable snapshot of the live elements. */
    List<T> toList();

    // ---- Iteration

    /** A bidirectional cursor starting at index 0. */
    default SeqListIterator<T> newIterator() {
        return SeqListIterator.over(this);
    }

    // ---- Teardown

    /** Runs the destructor over non-null live elements in index order and releases the storage. Idempotent. */
    void destroy();

    @Override
    default void close() {
        destroy();
    }
}
