package com.tessera.database.query;

import java.util.List;

/**
 * One page of results.
 *
 * @param items rows or models on this page
 * @param total matching rows across all pages
 * @param perPage page size
 * @param currentPage 1-based page number
 */
public record Paginated<T>(List<T> items, long total, int perPage, int currentPage) {

    public Paginated {
        items = List.copyOf(items);
    }

    public int lastPage() {
        return total == 0 ? 1 : (int) ((total + perPage - 1) / perPage);
    }

    public boolean hasMorePages() {
        return currentPage < lastPage();
    }
}
