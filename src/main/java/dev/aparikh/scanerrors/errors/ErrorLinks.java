package dev.aparikh.scanerrors.errors;

import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Link targets of the error listing.
 * Filter links are query-only so they resolve against the listing page that rendered them.
 * Values are form-encoded, which is what the servlet container decodes query parameters with,
 * so a value read back from a followed link equals the literal it was built from.
 */
public final class ErrorLinks {

    public static final String RESOURCE_DETAIL_PATH = "/project/{project}/resources/{id}/";

    private ErrorLinks() {
    }

    public static String modelFilter(String model) {
        return "?" + param(FilterState.PARAM_MODEL, model);
    }

    public static String messageFilter(String message) {
        return "?" + param(FilterState.PARAM_MESSAGE, message);
    }

    /**
     * Query string selecting exactly the given filters; {@code "?"} when none is active.
     */
    public static String filters(FilterState state) {
        List<String> params = new ArrayList<>(2);
        state.modelOpt().ifPresent(m -> params.add(param(FilterState.PARAM_MODEL, m)));
        state.messageOpt().ifPresent(m -> params.add(param(FilterState.PARAM_MESSAGE, m)));
        return "?" + String.join("&", params);
    }

    public static String resourceDetail(String project, String resourceId) {
        return UriComponentsBuilder.fromPath(RESOURCE_DETAIL_PATH)
                .encode()
                .buildAndExpand(project, resourceId)
                .toUriString();
    }

    private static String param(String name, String value) {
        return name + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
