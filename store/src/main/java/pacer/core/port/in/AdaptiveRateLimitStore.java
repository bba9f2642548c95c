package pacer.core.port.in;

import io.smallrye.mutiny.Uni;

import pacer.core.model.ratelimit.Priority;
import pacer.core.model.ratelimit.RateLimitStatus;

/**
 * Rate limit store that splits each resource's limit between user and background traffic.
 *
 * <p>The split follows recent user activity: background capacity shrinks, or is
 * paused, while users are active and grows back when they go idle. Operations
 * inherited from {@link RateLimitStore} act as background requests.
 */
public interface AdaptiveRateLimitStore extends RateLimitStore {

    Uni<Boolean> canProceed(String resource, Priority priority);

    Uni<Boolean> acquire(String resource, Priority priority);

    Uni<Void> record(String resource, Priority priority);

    /**
     * Report remaining capacity together with the current allocation.
     *
     * <p>{@code remaining} is relative to the total limit and counts every priority.
     * The share left to {@code priority} is
     * {@link pacer.core.model.ratelimit.AdaptiveStatus#priorityRemaining()}.
     */
    Uni<RateLimitStatus> getStatus(String resource, Priority priority);

    /**
     * Time until a request of the given priority may proceed.
     *
     * <p>A paused background request waits one recalculation interval.
     */
    Uni<Long> getWaitTime(String resource, Priority priority);
}
