package com.hcltech.rmg.seqlist.sortedset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * {@link ISortedSet} backed by a red-black tree.
 * A null comparator selects {@link DefaultOrdering}: null first, natural order within a
 * {@link Comparable} class, identity order otherwise.
 */
public final class TreeSortedSet<T> implements ISortedSet<T> {
    private static final Logger LOG = LoggerFactory.getLogger(TreeSortedSet.class);

    private final TreeSet<T> tree;
    private Consumer<? super T> destructor; // may be null
    private boolean destroyed;

    public TreeSortedSet(Comparator<? super T> comparator, Consumer<? super T> destructor) {
        this.tree = new TreeSet<T>(orDefault(comparator));
        this.destructor = destructor;
    }

    public TreeSortedSet(Comparator<? super T> comparator) {
        this(comparator, null);
    }

    @Override
    public void insert(T value) {
        checkLive();
        tree.add(value);
    }

    @Override
    public T search(T value) {
        checkLive();
        T candidate = tree.ceiling(value);
        if (candidate == null) return null;
        return tree.comparator().compare(candidate, value) == 0 ? candidate : null;
    }

    @Override
    public boolean contains(T value) {
        checkLive();
        return tree.contains(value);
    }

    @Override
    public int size() {
        checkLive();
        return tree.size();
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

    @Override
    public List<T> toList() {
        checkLive();
        return Collections.unmodifiableList(new ArrayList<>(tree));
    }

    @Override
    public void destroy() {
        if (destroyed) return;
        if (destructor != null) {
            for (T value : tree) {
                if (value != null) destructor.accept(value);
            }
        }
        LOG.debug("Destroyed sorted set of size {} (destructor ran: {})", tree.size(), destructor != null);
        tree.clear();
        destroyed = true;
    }

    private static <T> Comparator<? super T> orDefault(Comparator<? super T> comparator) {
        return comparator != null ? comparator : new DefaultOrdering();
    }

    private void checkLive() {
        if (destroyed) throw new IllegalStateException("sorted set has been destroyed");
    }

    @Override
    public String toString() {
        return tree.toString();
    }
}
