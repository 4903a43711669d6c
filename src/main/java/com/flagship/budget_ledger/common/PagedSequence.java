package com.flagship.budget_ledger.common;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Lazy, restartable sequence backed by keyset pagination.
 *
 * Each call to {@link #iterator()} starts again from the first page. A page is fetched
 * only when the previous one is exhausted, and iteration ends at the first short page.
 *
 * @param <T> element type
 */
public final class PagedSequence<T> implements Iterable<T> {

    private final Function<T, List<T>> pageAfter;
    private final int pageSize;

    /**
     * @param pageAfter fetches the page following the given element; receives {@code null} for the first page
     * @param pageSize  page size the fetch function uses, used to detect the last page
     */
    public PagedSequence(Function<T, List<T>> pageAfter, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive");
        }
        this.pageAfter = pageAfter;
        this.pageSize = pageSize;
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private List<T> page;
            private int index;
            private boolean exhausted;

            @Override
            public boolean hasNext() {
                if (page != null && index < page.size()) {
                    return true;
                }
                if (exhausted) {
                    return false;
                }
                T last = page == null ? null : page.get(page.size() - 1);
                page = pageAfter.apply(last);
                index = 0;
                if (page.size() < pageSize) {
                    exhausted = true;
                }
                return !page.isEmpty();
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return page.get(index++);
            }
        };
    }
}
