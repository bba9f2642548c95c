package pacer.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import pacer.core.model.ratelimit.RateLimitConfig;
import pacer.core.model.ratelimit.RateLimitStatus;

/**
 * Sliding window admission control for outbound requests.
 *
 * <p>Every resource is limited independently. {@link #canProceed} followed by
 * {@link #record} is approximate under concurrency; {@link #acquire} reserves
 * capacity atomically and never admits more than the limit per window.
 *
 * <p>Invalid keys and calls after {@link #close()} fail the returned {@link Uni}
 * before any storage access.
 */
public interface RateLimitStore extends AutoCloseable {

    /**
     * Check whether a request to the resource is currently allowed.
     *
     * @param resource the resource key
     * @return true if the window still has room; always false when the limit is zero
     */
    Uni<Boolean> canProceed(String resource);

    /**
     * Atomically reserve capacity for one request and record it.
     *
     * @param resource the resource key
     * @return true if a slot was reserved, false if the window is full
     */
    Uni<Boolean> acquire(String resource);

    /**
     * Record a request without checking capacity.
     *
     * @param resource the resource key
     * @return completion
     */
    Uni<Void> record(String resource);

    /**
     * Report remaining capacity.
     *
     * @param resource the resource key
     * @return the status
     */
    Uni<RateLimitStatus> getStatus(String resource);

    /**
     * Time until a request to the resource may proceed.
     *
     * @param resource the resource key
     * @return milliseconds to wait; the full window when the limit is zero
     */
    Uni<Long> getWaitTime(String resource);

    /**
     * Delete all recorded requests and slot claims of a resource.
     */
    Uni<Void> reset(String resource);

    /**
     * Delete all recorded requests, slot claims and cooldowns.
     */
    Uni<Void> clear();

    /**
     * Replace the limit of a resource.
     */
    void setResourceConfig(String resource, RateLimitConfig config);

    /**
     * Limit of a resource, or the store default if none was set.
     */
    RateLimitConfig getResourceConfig(String resource);

    /**
     * Hold back requests to an origin until the given time.
     *
     * @param origin the origin key
     * @param cooldownUntil epoch milliseconds
     * @return completion
     */
    Uni<Void> setCooldown(String origin, long cooldownUntil);

    /**
     * Active cooldown of an origin. Expired cooldowns are removed and reported as absent.
     *
     * @param origin the origin key
     * @return epoch milliseconds until which the origin is cooling down
     */
    Uni<Optional<Long>> getCooldown(String origin);

    /**
     * Remove the cooldown of an origin.
     */
    Uni<Void> clearCooldown(String origin);

    /**
     * Release the store. Idempotent; any later call fails with "Rate limit store has been destroyed".
     */
    @Override
    void close();

    /**
     * Alias of {@link #close()}.
     */
    default void destroy() {
        close();
    }
}
