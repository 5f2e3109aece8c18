package dev.aparikh.scanerrors.errors;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Display-ready form of one error record.
 */
@Schema(description = "Formatted error row")
public record FormattedRow(
        Cell model,
        Cell message,
        DetailsCell details,
        @Schema(description = "Traceback, verbatim")
        String traceback
) {

    /**
     * Text with an optional link target; {@code href} is null for plain text.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Cell(String text, String href) {

        public static Cell plain(String text) {
            return new Cell(text, null);
        }

        public boolean linked() {
            return href != null;
        }
    }

    /**
     * Related resource link first, when present, then one {@code key: value} line per details entry.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DetailsCell(Cell relatedResource, List<String> lines) {

        public DetailsCell {
            lines = List.copyOf(lines);
        }
    }
}
