package com.hcltech.rmg.seqlist.sortedset;

import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Ordering used when a set is built without a comparator.
 * <p>
 * Null sorts first. Two instances of the same {@link Comparable} class use their natural order.
 * Anything else is ordered by class name and then by identity, so every value, including plain
 * {@code Object}s, can be stored. Identity ties on {@link System#identityHashCode(Object)} are
 * broken by first-seen order, which makes the ordering stable for the life of the owning set.
 */
final class DefaultOrdering implements Comparator<Object> {

    private final Map<Object, Long> tieBreaks = new IdentityHashMap<>();
    private long nextTieBreak;

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public int compare(Object a, Object b) {
        if (a == b) return 0;
        if (a == null) return -1;
        if (b == null) return 1;

        Class<?> ca = a.getClass();
        Class<?> cb = b.getClass();
        if (ca == cb) {
            if (a instanceof Comparable) return ((Comparable) a).compareTo(b);
            return compareIdentity(a, b);
        }
        int byName = ca.getName().compareTo(cb.getName());
        return byName != 0 ? byName : compareIdentity(ca, cb);
    }

    private int compareIdentity(Object a, Object b) {
        int byHash = Integer.compare(System.identityHashCode(a), System.identityHashCode(b));
        return byHash != 0 ? byHash : Long.compare(tieBreak(a), tieBreak(b));
    }

    private long tieBreak(Object o) {
        return tieBreaks.computeIfAbsent(o, k -> nextTieBreak++);
    }
}
