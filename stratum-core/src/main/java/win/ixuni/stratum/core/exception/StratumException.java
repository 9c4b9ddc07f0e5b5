package win.ixuni.stratum.core.exception;

import lombok.Getter;

/**
 * Stratum base exception
 * <p>
 * Every failure carries a stable machine-readable error code next to the human message.
 */
@Getter
public class StratumException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    public StratumException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public StratumException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
}
