package dev.aparikh.scanerrors.errors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.scanerrors.model.ErrorRecord;
import dev.aparikh.scanerrors.model.RelatedResource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns one error record into its table row. Pure: same record, same row.
 */
@Component
public class ErrorRowFormatter {

    /**
     * Non-empty messages strictly shorter than this many code points link to their own filter.
     */
    public static final int MESSAGE_LINK_THRESHOLD = 100;

    private final ObjectMapper objectMapper;

    public ErrorRowFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public FormattedRow format(String project, ErrorRecord record) {
        return new FormattedRow(
                new FormattedRow.Cell(record.model(), ErrorLinks.modelFilter(record.model())),
                messageCell(record.message()),
                detailsCell(project, record),
                record.traceback()
        );
    }

    static boolean linksMessage(String message) {
        // an empty filter value means no filter, so an empty message has nothing to link to
        return !message.isEmpty() && message.codePointCount(0, message.length()) < MESSAGE_LINK_THRESHOLD;
    }

    private FormattedRow.Cell messageCell(String message) {
        if (linksMessage(message)) {
            return new FormattedRow.Cell(message, ErrorLinks.messageFilter(message));
        }
        return FormattedRow.Cell.plain(message);
    }

    private FormattedRow.DetailsCell detailsCell(String project, ErrorRecord record) {
        FormattedRow.Cell resource = null;
        RelatedResource related = record.relatedResource();
        if (related != null) {
            resource = new FormattedRow.Cell(related.path(), ErrorLinks.resourceDetail(project, related.id()));
        }
        List<String> lines = new ArrayList<>(record.details().size());
        for (Map.Entry<String, Object> entry : record.details().entrySet()) {
            lines.add(entry.getKey() + ": " + render(entry.getValue()));
        }
        return new FormattedRow.DetailsCell(resource, lines);
    }

    private String render(Object value) {
        if (value == null) return "null";
        if (value instanceof String s) return s;
        if (value instanceof Number || value instanceof Boolean) return String.valueOf(value);
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
