package pacer.core.exception;

/**
 * Base exception for failures of the underlying rate limit storage.
 */
public class RateLimitStoreException extends RuntimeException {

    public RateLimitStoreException(String message) {
        super(message);
    }

    public RateLimitStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
