package dev.aparikh.scanerrors.errors;

import dev.aparikh.scanerrors.config.ErrorListProperties;
import dev.aparikh.scanerrors.model.ErrorRecord;
import dev.aparikh.scanerrors.source.ErrorRecordSource;
import dev.aparikh.scanerrors.source.ErrorSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Fetch, filter, paginate and format a project's errors.
 * Filtering scans the whole snapshot; formatting only ever touches the requested page.
 */
@Service
public class ErrorListService {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorListService.class);

    private final ErrorRecordSource source;
    private final ErrorRowFormatter formatter;
    private final int pageSize;

    public ErrorListService(ErrorRecordSource source, ErrorRowFormatter formatter, ErrorListProperties properties) {
        if (properties.getPageSize() <= 0) {
            throw new IllegalArgumentException("errors.page-size must be > 0");
        }
        this.source = source;
        this.formatter = formatter;
        this.pageSize = properties.getPageSize();
    }

    public RenderModel list(String project, FilterState filters, int requestedPage) {
        return render(project, source.snapshot(project), filters, requestedPage);
    }

    public RenderModel render(String project, ErrorSnapshot snapshot, FilterState filters, int requestedPage) {
        List<ErrorRecord> filtered = ErrorFilter.apply(snapshot.records(), filters);
        Page<ErrorRecord> page = ErrorPaginator.paginate(filtered, requestedPage, pageSize);
        List<FormattedRow> rows = page.items().stream()
                .map(r -> formatter.format(project, r))
                .toList();

        LOG.debug("Errors of {} filtered by {}: page {}/{} ({} of {} records)",
                project, filters, page.pageNumber(), page.pageCount(), filtered.size(), snapshot.totalCount());

        return new RenderModel(
                rows,
                page.pageNumber(),
                page.pageCount(),
                page.hasPrevious(),
                page.hasNext(),
                pageSize,
                snapshot.totalCount(),
                filtered.size(),
                filters,
                ActiveFilter.of(filters)
        );
    }

    public long count(String project, FilterState filters) {
        List<ErrorRecord> records = source.snapshot(project).records();
        if (filters.isEmpty()) {
            return records.size();
        }
        return records.stream().filter(ErrorFilter.matches(filters)).count();
    }

    /**
     * Raw filtered records for export, unpaginated and unformatted.
     */
    public Flux<ErrorRecord> stream(String project, FilterState filters) {
        return Flux.defer(() -> {
            try {
                return Flux.fromIterable(ErrorFilter.apply(source.snapshot(project).records(), filters));
            } catch (RuntimeException e) {
                return Flux.error(new RuntimeException("Error stream failed for project " + project, e));
            }
        });
    }
}
