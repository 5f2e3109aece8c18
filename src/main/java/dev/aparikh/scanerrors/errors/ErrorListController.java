package dev.aparikh.scanerrors.errors;

import dev.aparikh.scanerrors.api.ErrorCountResponse;
import dev.aparikh.scanerrors.api.ErrorResponse;
import dev.aparikh.scanerrors.model.ErrorRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.regex.Pattern;

/**
 * REST Controller for a project's error listing.
 */
@RestController
@RequestMapping("/api/projects/{project}/errors")
@Tag(name = "Project Errors", description = "Filtered, paginated listing of the errors reported by a scan")
public class ErrorListController {

    static final String LAST_PAGE = "last";

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private final ErrorListService errorListService;

    public ErrorListController(ErrorListService errorListService) {
        this.errorListService = errorListService;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "List errors",
            description = "One page of the project's errors, narrowed by exact model and message matches. " +
                    "Out of range pages are clamped to the first or last page. " +
                    "Use page=last to jump to the last page."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Listing rendered",
                    content = @Content(schema = @Schema(implementation = RenderModel.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid page parameter",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "500",
                    description = "Error store unavailable",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<RenderModel> listErrors(
            @Parameter(description = "Project name", required = true)
            @PathVariable String project,
            @Parameter(description = "Exact model name filter")
            @RequestParam(name = FilterState.PARAM_MODEL, required = false) String model,
            @Parameter(description = "Exact message filter")
            @RequestParam(name = FilterState.PARAM_MESSAGE, required = false) String message,
            @Parameter(description = "Page number (1-based) or 'last'", example = "1")
            @RequestParam(name = "page", required = false) String page) {

        RenderModel result = errorListService.list(project, new FilterState(model, message), toPageNumber(page));
        return ResponseEntity.ok(result);
    }

    @GetMapping(value = "/count", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Count errors",
            description = "Number of the project's errors matching the filters, without rendering any row."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Count retrieved successfully",
                    content = @Content(schema = @Schema(implementation = ErrorCountResponse.class))
            ),
            @ApiResponse(
                    responseCode = "500",
                    description = "Error store unavailable",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<ErrorCountResponse> countErrors(
            @PathVariable String project,
            @RequestParam(name = FilterState.PARAM_MODEL, required = false) String model,
            @RequestParam(name = FilterState.PARAM_MESSAGE, required = false) String message) {

        long count = errorListService.count(project, new FilterState(model, message));
        return ResponseEntity.ok(new ErrorCountResponse(count));
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(
            summary = "Stream errors",
            description = "Every matching error record as a server-sent event. Suitable for exporting."
    )
    public Flux<ServerSentEvent<ErrorRecord>> streamErrors(
            @PathVariable String project,
            @RequestParam(name = FilterState.PARAM_MODEL, required = false) String model,
            @RequestParam(name = FilterState.PARAM_MESSAGE, required = false) String message) {

        return errorListService.stream(project, new FilterState(model, message))
                .map(error -> ServerSentEvent.<ErrorRecord>builder()
                        .data(error)
                        .build());
    }

    static int toPageNumber(String page) {
        if (page == null || page.isBlank()) {
            return 1;
        }
        String value = page.trim();
        if (LAST_PAGE.equals(value)) {
            return Integer.MAX_VALUE;
        }
        if (!INTEGER.matcher(value).matches()) {
            throw new IllegalArgumentException("page must be a number or '" + LAST_PAGE + "'");
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            // too many digits; clamping treats it like the nearest bound
            return value.startsWith("-") ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        }
    }
}
