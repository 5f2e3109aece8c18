package dev.aparikh.scanerrors.errors;

import dev.aparikh.scanerrors.model.ErrorRecord;

import java.util.List;
import java.util.function.Predicate;

/**
 * Stable, case-sensitive exact-match filtering of error records.
 */
public final class ErrorFilter {

    private ErrorFilter() {
    }

    public static List<ErrorRecord> apply(List<ErrorRecord> records, FilterState state) {
        if (state.isEmpty()) {
            return List.copyOf(records);
        }
        return records.stream()
                .filter(matches(state))
                .toList();
    }

    public static Predicate<ErrorRecord> matches(FilterState state) {
        return r -> state.modelOpt().map(m -> m.equals(r.model())).orElse(true)
                && state.messageOpt().map(m -> m.equals(r.message())).orElse(true);
    }
}
