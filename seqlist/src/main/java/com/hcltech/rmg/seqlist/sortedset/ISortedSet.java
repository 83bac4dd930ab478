package com.hcltech.rmg.seqlist.sortedset;

import java.util.List;
import java.util.function.Consumer;

/**
 * Ordered, deduplicating set with an optional drop policy.
 * Equality is decided by the set's comparator, not by {@code equals}.
 * Single-threaded.
 */
public interface ISortedSet<T> extends AutoCloseable {

    /** Adds the value unless an element comparing equal is already present. */
    void insert(T value);

    /** @return the stored element comparing equal to {@code value}, or null */
    T search(T value);

    boolean contains(T value);

    int size();

    /** Replaces the drop policy run by {@link #destroy()}; null clears it. */
    void setDestructor(Consumer<? super T> destructor);

    Consumer<? super T> destructor();

    /** Elements in ascending order. */
    List<T> toList();

    /** Runs the destructor (if any) over every non-null element in ascending order. */
    void destroy();

    @Override
    default void close() {
        destroy();
    }
}
