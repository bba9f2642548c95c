package pacer.core.model.ratelimit;

import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time view of a resource's window.
 *
 * <p>{@code resetTime} is {@code now + windowMs}, an upper bound. The exact time
 * until capacity frees up is reported by {@code getWaitTime}.
 *
 * @param remaining requests of any priority still allowed in the current window
 * @param resetTime approximate end of the current window
 * @param limit the configured limit
 * @param adaptive allocation details, present only for the adaptive store
 */
public record RateLimitStatus(long remaining, Instant resetTime, int limit, Optional<AdaptiveStatus> adaptive) {

    public RateLimitStatus {
        if (adaptive == null) {
            adaptive = Optional.empty();
        }
    }

    /**
     * Build a status from a window count.
     *
     * @param config the resource config
     * @param count requests counted in the window
     * @param now epoch milliseconds
     * @return the status
     */
    public static RateLimitStatus of(RateLimitConfig config, long count, long now) {
        return new RateLimitStatus(
                Math.max(0, config.limit() - count),
                Instant.ofEpochMilli(now + config.windowMs()),
                config.limit(),
                Optional.empty());
    }

    /**
     * Return a copy carrying adaptive allocation details.
     *
     * <p>{@code remaining} stays resource-wide; the share left to {@code priority}
     * is reported as {@link AdaptiveStatus#priorityRemaining()}.
     *
     * @param snapshot the allocation in effect
     * @param recentUserActivity user requests inside the monitoring window
     * @param priority the priority the status is reported for
     * @param priorityCount requests of {@code priority} counted in the window
     * @return the status with adaptive details
     */
    public RateLimitStatus withAdaptive(
            CapacitySnapshot snapshot, int recentUserActivity, Priority priority, long priorityCount) {
        return new RateLimitStatus(
                remaining,
                resetTime,
                limit,
                Optional.of(AdaptiveStatus.of(snapshot, recentUserActivity, priority, priorityCount)));
    }
}
