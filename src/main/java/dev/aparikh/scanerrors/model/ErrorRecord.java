package dev.aparikh.scanerrors.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One error reported by a scan. Immutable snapshot, read-only for the listing.
 * When details carry both {@link #KEY_RESOURCE_PK} and {@link #KEY_RESOURCE_PATH}
 * the resource is exposed as {@link #relatedResource()}; the keys stay in details.
 */
public record ErrorRecord(
        String model,
        String message,
        Map<String, Object> details,
        String traceback,
        RelatedResource relatedResource
) {
    public static final String KEY_RESOURCE_PK = "codebase_resource_pk";
    public static final String KEY_RESOURCE_PATH = "codebase_resource_path";

    // Solr field names
    public static final String FIELD_ID = "id";
    public static final String FIELD_PROJECT = "project";
    public static final String FIELD_MODEL = "model";
    public static final String FIELD_MESSAGE = "message";
    public static final String FIELD_DETAILS = "details_json";
    public static final String FIELD_TRACEBACK = "traceback";
    public static final String FIELD_CREATED_DATE = "created_date";

    public ErrorRecord {
        if (model == null || model.isEmpty()) {
            throw new IllegalArgumentException("model must be provided");
        }
        message = message == null ? "" : message;
        traceback = traceback == null ? "" : traceback;
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        if (relatedResource == null) {
            relatedResource = resourceFrom(details);
        }
    }

    public ErrorRecord(String model, String message, Map<String, Object> details, String traceback) {
        this(model, message, details, traceback, null);
    }

    public Optional<RelatedResource> relatedResourceOpt() {
        return Optional.ofNullable(relatedResource);
    }

    private static RelatedResource resourceFrom(Map<String, Object> details) {
        Object pk = details.get(KEY_RESOURCE_PK);
        Object path = details.get(KEY_RESOURCE_PATH);
        if (pk == null || path == null) {
            return null;
        }
        return new RelatedResource(String.valueOf(pk), String.valueOf(path));
    }
}
