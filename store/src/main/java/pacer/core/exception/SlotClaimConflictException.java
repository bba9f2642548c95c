package pacer.core.exception;

/**
 * Thrown when an admission slot is already held by another caller.
 *
 * <p>Acquisition treats this as "try the next slot", never as a failure.
 */
public class SlotClaimConflictException extends RateLimitStoreException {

    public SlotClaimConflictException(String resource, String scope, int slotIndex) {
        super("Slot %d of %s/%s is already claimed".formatted(slotIndex, resource, scope));
    }

    public SlotClaimConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
