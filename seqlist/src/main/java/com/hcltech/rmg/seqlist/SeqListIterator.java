package com.hcltech.rmg.seqlist;

/**
 * Bidirectional index cursor over an {@link ISeqList}.
 * <p>
 * Does not own the list and does not snapshot it: the length is re-read on every step, so
 * removals made elsewhere shift what the cursor sees. At either end a step returns null and
 * leaves the cursor where it is.
 */
public final class SeqListIterator<T> {

    private ISeqList<T> list; // nullable; cleared by destroy()
    private int cursor;       // next index returned by next()

    private SeqListIterator(ISeqList<T> list, int cursor) {
        this.list = list;
        this.cursor = cursor;
    }

    /** @param list may be null, in which case every step returns null */
    public static <T> SeqListIterator<T> over(ISeqList<T> list) {
        return new SeqListIterator<>(list, 0);
    }

    /** @return the element at the cursor, advancing it; null at the end */
    public T next() {
        if (list == null || cursor >= list.length()) return null;
        return list.get(cursor++);
    }

    /** @return the element before the cursor, moving back onto it; null at the start */
    public T previous() {
        if (list == null || cursor == 0) return null;
        return list.get(--cursor);
    }

    /** Same list, same position; the two cursors move independently afterwards. */
    public SeqListIterator<T> copy() {
        return new SeqListIterator<>(list, cursor);
    }

    public int cursor() {
        return cursor;
    }

    /** Detaches from the list. The list itself is untouched. */
    public void destroy() {
        list = null;
        cursor = 0;
    }
}
