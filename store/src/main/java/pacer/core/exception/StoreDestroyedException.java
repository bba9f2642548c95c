package pacer.core.exception;

/**
 * Thrown when a store is used after {@code close()}.
 */
public class StoreDestroyedException extends IllegalStateException {

    public static final String MESSAGE = "Rate limit store has been destroyed";

    public StoreDestroyedException() {
        super(MESSAGE);
    }
}
