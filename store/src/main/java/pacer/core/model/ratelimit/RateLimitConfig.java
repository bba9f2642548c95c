package pacer.core.model.ratelimit;

import java.time.Duration;

/**
 * Sliding window limit for a single resource.
 *
 * <p>A limit of zero blocks the resource entirely; it never means "unlimited".
 *
 * @param limit the maximum number of requests per window
 * @param windowMs the trailing window length in milliseconds
 */
public record RateLimitConfig(int limit, long windowMs) {

    /**
     * Store-wide default used when nothing else is configured: 60 requests per minute.
     */
    public static final RateLimitConfig DEFAULT = new RateLimitConfig(60, 60_000L);

    public RateLimitConfig {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative");
        }
        if (windowMs < 0) {
            throw new IllegalArgumentException("windowMs must be non-negative");
        }
    }

    /**
     * Create a config from a {@link Duration} window.
     *
     * @param limit the maximum requests per window
     * @param window the window length
     * @return the config
     */
    public static RateLimitConfig of(int limit, Duration window) {
        return new RateLimitConfig(limit, window.toMillis());
    }

    /**
     * Whether this config blocks every request.
     */
    public boolean blocksAll() {
        return limit == 0;
    }

    /**
     * First timestamp (inclusive) still inside the window ending at {@code now}.
     *
     * <p>A record at {@code t} stops counting once {@code now >= t + windowMs}.
     */
    public long windowStart(long now) {
        return now - windowMs + 1;
    }
}
