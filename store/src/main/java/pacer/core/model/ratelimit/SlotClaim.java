package pacer.core.model.ratelimit;

/**
 * A claim on one numbered admission slot of a resource.
 *
 * <p>A slot is free when it has never been claimed or when its previous claim
 * has expired. At most {@code limit} slots exist per scope, which bounds the
 * number of successful acquisitions inside any window.
 *
 * @param resource the resource key
 * @param scope the slot namespace: {@link #DEFAULT_SCOPE} or a priority value
 * @param slotIndex the slot number, from zero to limit - 1
 * @param claimedAt epoch milliseconds of the claim
 * @param expiresAt epoch milliseconds at which the slot becomes free again
 */
public record SlotClaim(String resource, String scope, int slotIndex, long claimedAt, long expiresAt) {

    /** Scope used by the non-adaptive store. */
    public static final String DEFAULT_SCOPE = "default";

    public SlotClaim {
        if (slotIndex < 0) {
            throw new IllegalArgumentException("slotIndex must be non-negative");
        }
        if (expiresAt < claimedAt) {
            throw new IllegalArgumentException("expiresAt must not precede claimedAt");
        }
    }

    /**
     * Whether this claim no longer holds its slot at {@code now}.
     */
    public boolean isExpired(long now) {
        return expiresAt <= now;
    }

    /**
     * Slot scope for the given priority, or the default scope when none.
     */
    public static String scopeFor(Priority priority) {
        return priority == null ? DEFAULT_SCOPE : priority.value();
    }
}
