package dev.aparikh.scanerrors.errors;

import java.util.List;

/**
 * Slices a collection into fixed-size pages. Out of range page numbers are clamped, never rejected.
 */
public final class ErrorPaginator {

    private ErrorPaginator() {
    }

    public static int pageCount(int total, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be > 0");
        }
        return (int) Math.ceil((double) total / pageSize);
    }

    public static <T> Page<T> paginate(List<T> records, int pageNumber, int pageSize) {
        int pageCount = pageCount(records.size(), pageSize);
        int page = Math.max(1, Math.min(pageNumber, Math.max(pageCount, 1)));
        if (pageCount == 0) {
            return new Page<>(List.of(), page, 0, false, false);
        }
        int from = (page - 1) * pageSize;
        int to = Math.min(from + pageSize, records.size());
        return new Page<>(records.subList(from, to), page, pageCount, page > 1, page < pageCount);
    }
}
