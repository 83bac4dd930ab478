package com.hcltech.rmg.seqlist;

import com.hcltech.rmg.common.ISystemProps;
import com.hcltech.rmg.common.random.IRandomInts;
import com.hcltech.rmg.seqlist.sortedset.ISortedSet;
import com.hcltech.rmg.seqlist.sortedset.TreeSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Array-backed {@link ISeqList}.
 * <p>
 * When an append finds the array full it is reallocated to {@code max(capacity * 2 + 5, capacity + 1)}
 * slots, so N appends cost amortised O(1) each. Slots past {@code length} are kept null.
 *
 * @param <T> element type; null elements are allowed
 */
public final class SeqList<T> implements ISeqList<T>, ISeqListTestHooks {
    private static final Logger LOG = LoggerFactory.getLogger(SeqList.class);

    /** Minimum number of slots added by a reallocation. */
    static final int MINIMUM_EXPAND_SIZE = 5;

    private static final Object[] EMPTY = new Object[0];

    private T[] values;                    // length == capacity
    private int length;                    // 0..values.length
    private Consumer<? super T> destructor; // may be null
    private boolean destroyed;

    @SuppressWarnings("unchecked")
    private SeqList(int length, Consumer<? super T> destructor) {
        if (length < 0) throw new IllegalArgumentException("length must be >= 0 but was " + length);
        this.values = (T[]) (length == 0 ? EMPTY : new Object[length]);
        this.length = length;
        this.destructor = destructor;
    }

    // ------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------

    public static <T> SeqList<T> create() {
        return new SeqList<>(0, null);
    }

    /** {@code length} null slots; capacity equals length. */
    public static <T> SeqList<T> createWithLength(int length) {
        return new SeqList<>(length, null);
    }

    public static <T> SeqList<T> createWithLengthAndDestructor(int length, Consumer<? super T> destructor) {
        return new SeqList<>(length, destructor);
    }

    @SafeVarargs
    public static <T> SeqList<T> of(T... values) {
        SeqList<T> list = new SeqList<>(values.length, null);
        System.arraycopy(values, 0, list.values, 0, values.length);
        return list;
    }

    /** Null-tolerant length: 0 for a null list. */
    public static int length(ISeqList<?> list) {
        return list == null ? 0 : list.length();
    }

    /** Null-tolerant destroy. */
    public static void destroy(ISeqList<?> list) {
        if (list != null) list.destroy();
    }

    /** Concatenation, in order, of every list held by {@code lists}. Null entries count as empty. */
    public static <T> SeqList<T> joinAll(ISeqList<? extends ISeqList<? extends T>> lists) {
        Objects.requireNonNull(lists, "lists");
        SeqList<T> joined = create();
        for (int i = 0; i < lists.length(); i++) {
            ISeqList<? extends T> list = lists.get(i);
            if (list != null) joined.appendAll(list);
        }
        return joined;
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    @Override
    public int length() {
        checkLive();
        return length;
    }

    @Override
    public T get(int index) {
        checkLive();
        return values[Objects.checkIndex(index, length)];
    }

    @Override
    public void set(int index, T value) {
        checkLive();
        values[Objects.checkIndex(index, length)] = value;
    }

    // ------------------------------------------------------------------
    // Growth and mutation
    // ------------------------------------------------------------------

    @Override
    public void append(T value) {
        checkLive();
        if (length == values.length) {
            grow();
        }
        values[length++] = value;
    }

    @SuppressWarnings("unchecked")
    private void grow() {
        int capacity = values.length;
        int newCapacity = Math.max(capacity * 2 + MINIMUM_EXPAND_SIZE, capacity + 1);
        T[] grown = (T[]) new Object[newCapacity];
        System.arraycopy(values, 0, grown, 0, length);
        values = grown;
        if (LOG.isTraceEnabled()) {
            LOG.trace("Grew list from capacity {} to {}", capacity, newCapacity);
        }
    }

    @Override
    public void appendAll(ISeqList<? extends T> source) {
        Objects.requireNonNull(source, "source");
        if (source == this) throw new IllegalArgumentException("cannot append a list to itself");
        checkLive();
        for (int i = 0; i < source.length(); i++) {
            append(source.get(i));
        }
    }

    @Override
    public void setDestructor(Consumer<? super T> destructor) {
        checkLive();
        this.destructor = destructor;
    }

    @Override
    public Consumer<? super T> destructor() {
        return destructor;
    }

    // ------------------------------------------------------------------
    // Removal
    // ------------------------------------------------------------------

    @Override
    public T remove(int index) {
        checkLive();
        Objects.checkIndex(index, length);
        T removed = values[index];
        System.arraycopy(values, index + 1, values, index, length - index - 1);
        values[--length] = null;
        return removed;
    }

    @Override
    public T removeFirst() {
        return remove(0);
    }

    @Override
    public T pop() {
        checkNotEmpty("pop");
        return remove(length - 1);
    }

    @Override
    public void removeItem(T value) {
        int index = indexOf(value);
        if (index >= 0) remove(index);
    }

    @Override
    public T peek() {
        checkNotEmpty("peek");
        return values[length - 1];
    }

    // ------------------------------------------------------------------
    // Query
    // ------------------------------------------------------------------

    @Override
    public boolean contains(T value) {
        return indexOf(value) >= 0;
    }

    @Override
    public int indexOf(T value) {
        checkLive();
        for (int i = 0; i < length; i++) {
            if (values[i] == value) return i;
        }
        return -1;
    }

    // ------------------------------------------------------------------
    // Bulk / derived
    // ------------------------------------------------------------------

    @Override
    public SeqList<T> copy(Consumer<? super T> destructorForCopy) {
        SeqList<T> copy = new SeqList<>(0, destructorForCopy);
        copy.appendAll(this);
        return copy;
    }

    @Override
    public void reverse() {
        checkLive();
        for (int i = 0, j = length - 1; i < j; i++, j--) {
            swap(i, j);
        }
    }

    @Override
    public void sort(Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        checkLive();
        Arrays.sort(values, 0, length, comparator);
    }

    @Override
    public void shuffle() {
        shuffle(DefaultRandom.INSTANCE);
    }

    @Override
    public void shuffle(IRandomInts random) {
        Objects.requireNonNull(random, "random");
        checkLive();
        for (int i = 0; i < length; i++) {
            swap(i, random.nextInt(0, length));
        }
    }

    private void swap(int i, int j) {
        T tmp = values[i];
        values[i] = values[j];
        values[j] = tmp;
    }

    @Override
    public ISortedSet<T> toSortedSet(Comparator<? super T> comparator) {
        checkLive();
        ISortedSet<T> set = new TreeSortedSet<>(comparator, null);
        for (int i = 0; i < length; i++) {
            set.insert(values[i]);
        }
        return set;
    }

    @Override
    public SeqList<T> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        checkLive();
        SeqList<T> result = create();
        for (int i = 0; i < length; i++) {
            T value = values[i];
            if (predicate.test(value)) result.append(value);
        }
        return result;
    }

    @Override
    public SeqList<T> filterToInclude(ISortedSet<T> set) {
        Objects.requireNonNull(set, "set");
        return filter(set::contains);
    }

    @Override
    public SeqList<T> filterToExclude(ISortedSet<T> set) {
        Objects.requireNonNull(set, "set");
        return filter(value -> !set.contains(value));
    }

    @Override
    public ISortedSet<T> convertToSortedSet() {
        ISortedSet<T> set = toSortedSet(null);
        set.setDestructor(destructor);
        LOG.debug("Converted list of length {} into sorted set of size {}", length, set.size());
        destructor = null;
        destroy();
        return set;
    }

    @Override
    public List<T> toList() {
        checkLive();
        return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(values).subList(0, length)));
    }

    // ------------------------------------------------------------------
    // Iteration
    // ------------------------------------------------------------------

    /** Forward iterator over indices; re-reads the length at every step. */
    @Override
    public Iterator<T> iterator() {
        checkLive();
        return new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return next < length();
            }

            @Override
            public T next() {
                if (!hasNext()) throw new NoSuchElementException();
                return values[next++];
            }
        };
    }

    // ------------------------------------------------------------------
    // Teardown
    // ------------------------------------------------------------------

    @Override
    @SuppressWarnings("unchecked")
    public void destroy() {
        if (destroyed) return;
        if (destructor != null) {
            for (int i = 0; i < length; i++) {
                if (values[i] != null) destructor.accept(values[i]);
            }
        }
        LOG.debug("Destroyed list of length {} (destructor ran: {})", length, destructor != null);
        values = (T[]) EMPTY;
        length = 0;
        destroyed = true;
    }

    private void checkLive() {
        if (destroyed) throw new IllegalStateException("list has been destroyed");
    }

    private void checkNotEmpty(String operation) {
        checkLive();
        if (length == 0) throw new IllegalStateException("cannot " + operation + " an empty list");
    }

    @Override
    public String toString() {
        if (destroyed) return "SeqList[destroyed]";
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(values[i]);
        }
        return sb.append(']').toString();
    }

    // ---- test hooks ----
    @Override
    public int _capacityForTest() {
        return values.length;
    }

    @Override
    public boolean _isDestroyedForTest() {
        return destroyed;
    }

    private static final class DefaultRandom {
        static final IRandomInts INSTANCE = IRandomInts.fromSystemProps(ISystemProps.real);
    }
}
