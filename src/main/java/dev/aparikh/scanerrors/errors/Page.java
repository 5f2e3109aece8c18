package dev.aparikh.scanerrors.errors;

import java.util.List;

/**
 * A window of at most one page size into a filtered collection.
 * {@code pageNumber} is 1-based, {@code pageCount} is 0 for an empty collection.
 */
public record Page<T>(
        List<T> items,
        int pageNumber,
        int pageCount,
        boolean hasPrevious,
        boolean hasNext
) {
    public Page {
        items = List.copyOf(items);
    }
}
