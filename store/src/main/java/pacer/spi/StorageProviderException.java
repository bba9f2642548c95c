package pacer.spi;

/**
 * Thrown when a rate limit store provider cannot be found or fails to initialize.
 */
public class StorageProviderException extends RuntimeException {

    public StorageProviderException(String message) {
        super(message);
    }

    public StorageProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
