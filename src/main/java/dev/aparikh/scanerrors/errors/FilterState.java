package dev.aparikh.scanerrors.errors;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Optional;

/**
 * Exact-match constraints chosen for the current request. A null or empty value means no constraint.
 */
@Schema(description = "Active exact-match filters")
public record FilterState(
        @Schema(description = "Originating model name", example = "CodebaseResource")
        String model,

        @Schema(description = "Full error message", example = "Permission denied")
        String message
) {
    public static final String PARAM_MODEL = "model";
    public static final String PARAM_MESSAGE = "message";

    private static final FilterState NONE = new FilterState(null, null);

    public FilterState {
        model = model == null || model.isEmpty() ? null : model;
        message = message == null || message.isEmpty() ? null : message;
    }

    public static FilterState none() {
        return NONE;
    }

    public Optional<String> modelOpt() {
        return Optional.ofNullable(model);
    }

    public Optional<String> messageOpt() {
        return Optional.ofNullable(message);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return model == null && message == null;
    }

    public FilterState withoutModel() {
        return new FilterState(null, message);
    }

    public FilterState withoutMessage() {
        return new FilterState(model, null);
    }
}
