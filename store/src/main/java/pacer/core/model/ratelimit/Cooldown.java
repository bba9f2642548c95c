package pacer.core.model.ratelimit;

/**
 * A "do not send before" marker for an origin, usually set from a Retry-After header.
 *
 * @param origin the origin key
 * @param cooldownUntil epoch milliseconds until which requests should be held back
 */
public record Cooldown(String origin, long cooldownUntil) {

    /**
     * Whether the cooldown still applies at {@code now}.
     */
    public boolean isActive(long now) {
        return cooldownUntil > now;
    }
}
