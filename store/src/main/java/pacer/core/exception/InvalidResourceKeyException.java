package pacer.core.exception;

/**
 * Thrown when a resource or origin key is empty, too long or contains control characters.
 */
public class InvalidResourceKeyException extends IllegalArgumentException {

    public InvalidResourceKeyException(String message) {
        super(message);
    }
}
