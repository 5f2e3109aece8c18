package dev.aparikh.scanerrors.errors;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Everything the errors page needs for one request.
 */
@Schema(description = "Error listing page")
public record RenderModel(
        @Schema(description = "Formatted rows of the current page")
        List<FormattedRow> rows,

        @Schema(description = "Current page number (1-based)", example = "1")
        int pageNumber,

        @Schema(description = "Number of pages of the filtered listing", example = "3")
        int pageCount,

        @Schema(description = "Whether a previous page exists")
        boolean hasPrevious,

        @Schema(description = "Whether a next page exists")
        boolean hasNext,

        @Schema(description = "Rows per page", example = "50")
        int pageSize,

        @Schema(description = "Number of errors of the project, unfiltered", example = "120")
        long totalCount,

        @Schema(description = "Number of errors matching the filters", example = "42")
        long filteredCount,

        @Schema(description = "Filters applied to this listing")
        FilterState filters,

        @Schema(description = "Active filters with links to clear them")
        List<ActiveFilter> activeFilters
) {
}
