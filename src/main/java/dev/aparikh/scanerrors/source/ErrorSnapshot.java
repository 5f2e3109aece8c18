package dev.aparikh.scanerrors.source;

import dev.aparikh.scanerrors.model.ErrorRecord;

import java.util.List;

/**
 * Ordered error records of one project plus the unfiltered total.
 */
public record ErrorSnapshot(
        List<ErrorRecord> records,
        long totalCount
) {
    public ErrorSnapshot {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
