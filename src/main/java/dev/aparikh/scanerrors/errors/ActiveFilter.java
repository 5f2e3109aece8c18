package dev.aparikh.scanerrors.errors;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Breadcrumb of one active filter. {@code clearHref} drops this filter and keeps the others.
 */
@Schema(description = "Active filter with its clear link")
public record ActiveFilter(
        @Schema(description = "Query parameter name", example = "model")
        String field,

        @Schema(description = "Filter value", example = "CodebaseResource")
        String value,

        @Schema(description = "Link removing this filter", example = "?message=Permission+denied")
        String clearHref
) {

    static List<ActiveFilter> of(FilterState state) {
        List<ActiveFilter> filters = new ArrayList<>(2);
        state.modelOpt().ifPresent(m -> filters.add(
                new ActiveFilter(FilterState.PARAM_MODEL, m, ErrorLinks.filters(state.withoutModel()))));
        state.messageOpt().ifPresent(m -> filters.add(
                new ActiveFilter(FilterState.PARAM_MESSAGE, m, ErrorLinks.filters(state.withoutMessage()))));
        return List.copyOf(filters);
    }
}
