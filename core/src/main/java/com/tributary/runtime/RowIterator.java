package com.tributary.runtime;

import java.util.Iterator;

/**
 * Iterator over the rows of one partition.
 *
 * <p>Rows are {@code Object[]} in the internal value representation described
 * on {@link com.tributary.types.DataType}. Callers must close the iterator,
 * also when they stop early; closing twice is allowed.
 */
public interface RowIterator extends Iterator<Object[]>, AutoCloseable {

    /**
     * Releases the resources behind this iterator. Does not throw checked
     * exceptions.
     */
    @Override
    void close();

    /**
     * Returns an iterator over an in-memory row list.
     *
     * @param rows the rows
     * @return an iterator whose close is a no-op
     */
    static RowIterator of(Iterable<Object[]> rows) {
        Iterator<Object[]> it = rows.iterator();
        return new RowIterator() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public Object[] next() {
                return it.next();
            }

            @Override
            public void close() {
            }
        };
    }

    /**
     * Returns an iterator with no rows.
     *
     * @return the empty iterator
     */
    static RowIterator empty() {
        return of(java.util.List.of());
    }
}
