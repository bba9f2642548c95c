package pacer.core.service.ratelimit;

import io.smallrye.mutiny.Uni;

import pacer.core.model.ratelimit.Priority;
import pacer.core.model.ratelimit.RateLimitConfig;
import pacer.core.port.out.RateLimitRepository;

/**
 * Counts requests inside a resource's trailing window.
 *
 * <p>A request recorded at {@code t} counts while {@code now < t + windowMs}.
 */
public final class SlidingWindowCounter {

    private final RateLimitRepository repository;

    public SlidingWindowCounter(RateLimitRepository repository) {
        this.repository = repository;
    }

    /**
     * Count requests in the window ending at {@code now}.
     *
     * @param priority the priority to count, or null for all
     */
    public Uni<Long> count(String resource, Priority priority, RateLimitConfig config, long now) {
        return repository.countSince(resource, priority, config.windowStart(now));
    }

    /**
     * Milliseconds until the window has room for one more request.
     *
     * <p>Zero while the count is below {@code effectiveLimit}; otherwise the time until
     * the oldest request in the window ages out. Zero when no such request is found,
     * which happens if the resource was reset concurrently.
     *
     * @param priority the priority to count, or null for all
     * @param effectiveLimit the limit the count is compared against
     */
    public Uni<Long> waitTime(
            String resource, Priority priority, RateLimitConfig config, int effectiveLimit, long now) {
        return count(resource, priority, config, now).flatMap(count -> {
            if (count < effectiveLimit) {
                return Uni.createFrom().item(0L);
            }
            return repository
                    .findOldestSince(resource, priority, config.windowStart(now))
                    .map(oldest -> oldest.map(timestamp -> Math.max(0L, timestamp + config.windowMs() - now))
                            .orElse(0L));
        });
    }
}
