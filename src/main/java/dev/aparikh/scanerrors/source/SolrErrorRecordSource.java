package dev.aparikh.scanerrors.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.scanerrors.model.ErrorRecord;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.client.solrj.util.ClientUtils;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.params.CursorMarkParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a project's error documents from Solr, oldest first, using cursor marks.
 */
public class SolrErrorRecordSource implements ErrorRecordSource {

    private static final Logger LOG = LoggerFactory.getLogger(SolrErrorRecordSource.class);

    private static final TypeReference<LinkedHashMap<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };

    private final SolrClient solr;
    private final ObjectMapper objectMapper;
    private final int batchSize;

    public SolrErrorRecordSource(SolrClient solr, ObjectMapper objectMapper, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.solr = solr;
        this.objectMapper = objectMapper;
        this.batchSize = batchSize;
    }

    private static String getFieldAsString(SolrDocument d, String fieldName) {
        Object value = d.getFieldValue(fieldName);
        if (value == null) return null;
        if (value instanceof String) return (String) value;
        if (value instanceof Collection<?> collection && !collection.isEmpty()) {
            return String.valueOf(collection.iterator().next());
        }
        return String.valueOf(value);
    }

    @Override
    public ErrorSnapshot snapshot(String project) {
        if (project == null || project.isBlank()) {
            throw new IllegalArgumentException("project must be provided");
        }
        try {
            List<ErrorRecord> records = new ArrayList<>();
            long totalCount = -1;
            int skipped = 0;
            String cursorMark = CursorMarkParams.CURSOR_MARK_START;
            while (true) {
                SolrQuery q = buildSolrQuery(project);
                q.set(CursorMarkParams.CURSOR_MARK_PARAM, cursorMark);
                QueryResponse resp = solr.query(q);
                if (totalCount < 0) {
                    totalCount = resp.getResults().getNumFound();
                }
                for (SolrDocument doc : resp.getResults()) {
                    ErrorRecord record = fromSolrDoc(doc);
                    if (record == null) {
                        skipped++;
                    } else {
                        records.add(record);
                    }
                }
                String next = resp.getNextCursorMark();
                if (next == null || next.equals(cursorMark)) {
                    break;
                }
                cursorMark = next;
            }
            LOG.debug("Fetched {} error records for project {}", records.size(), project);
            return new ErrorSnapshot(records, Math.max(totalCount - skipped, records.size()));
        } catch (SolrServerException | IOException e) {
            throw new RuntimeException("Error record fetch failed", e);
        }
    }

    private SolrQuery buildSolrQuery(String project) {
        SolrQuery q = new SolrQuery("*:*");
        q.addFilterQuery(ErrorRecord.FIELD_PROJECT + ":\"" + ClientUtils.escapeQueryChars(project) + "\"");
        q.setRows(batchSize);
        // cursor marks need the unique key as the final tie breaker
        q.setSort(SolrQuery.SortClause.asc(ErrorRecord.FIELD_CREATED_DATE));
        q.addSort(SolrQuery.SortClause.asc(ErrorRecord.FIELD_ID));
        return q;
    }

    /**
     * Null for a document without a model; such documents are left out of the snapshot.
     */
    private ErrorRecord fromSolrDoc(SolrDocument d) {
        String model = getFieldAsString(d, ErrorRecord.FIELD_MODEL);
        if (model == null || model.isEmpty()) {
            LOG.warn("Skipping error {} without a model", getFieldAsString(d, ErrorRecord.FIELD_ID));
            return null;
        }
        String message = getFieldAsString(d, ErrorRecord.FIELD_MESSAGE);
        String traceback = getFieldAsString(d, ErrorRecord.FIELD_TRACEBACK);
        Map<String, Object> details = parseDetails(getFieldAsString(d, ErrorRecord.FIELD_ID),
                getFieldAsString(d, ErrorRecord.FIELD_DETAILS));
        return new ErrorRecord(model, message, details, traceback);
    }

    private Map<String, Object> parseDetails(String id, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (JsonProcessingException e) {
            LOG.warn("Ignoring unreadable details of error {}: {}", id, e.getOriginalMessage());
            return Map.of();
        }
    }
}
