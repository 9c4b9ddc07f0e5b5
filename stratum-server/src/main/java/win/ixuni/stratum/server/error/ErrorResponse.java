package win.ixuni.stratum.server.error;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.stratum.core.exception.StratumException;
import win.ixuni.stratum.core.exception.ValidationException;

import java.util.Locale;
import java.util.UUID;

/**
 * Structured failure result
 * <p>
 * Any exception raised by an operation can be turned into one of these; unknown failures become
 * {@code InternalError} without leaking their message.
 */
@Slf4j
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    public static final String INTERNAL_ERROR = "InternalError";

    private String code;

    private String message;

    /**
     * What the failed operation was acting on, e.g. "policy/archive"
     */
    private String resource;

    private String requestId;

    private boolean retryable;

    public static ErrorResponse from(Throwable error, String resource) {
        if (error instanceof StratumException) {
            StratumException ex = (StratumException) error;
            log.warn("Operation on {} failed: {} - {}", resource, ex.getErrorCode(), ex.getMessage());
            return ErrorResponse.builder()
                    .code(ex.getErrorCode())
                    .message(ex.getMessage())
                    .resource(resource)
                    .requestId(generateRequestId())
                    .retryable(ex.isRetryable())
                    .build();
        }
        if (error instanceof IllegalArgumentException) {
            log.warn("Invalid argument for {}: {}", resource, error.getMessage());
            return ErrorResponse.builder()
                    .code(ValidationException.ERROR_CODE)
                    .message(error.getMessage())
                    .resource(resource)
                    .requestId(generateRequestId())
                    .build();
        }

        log.error("Internal error on {}: {}", resource, error.getMessage(), error);
        return ErrorResponse.builder()
                .code(INTERNAL_ERROR)
                .message("An internal error occurred")
                .resource(resource)
                .requestId(generateRequestId())
                .build();
    }

    private static String generateRequestId() {
        return UUID.randomUUID().toString().replace("-", "").toUpperCase(Locale.ROOT).substring(0, 16);
    }
}
