package pacer.core.model.ratelimit;

/**
 * Window usage of a single resource.
 *
 * @param resource the resource key
 * @param requestCount requests inside the current window
 * @param limit the configured limit
 * @param windowMs the configured window
 */
public record ResourceUsage(String resource, long requestCount, int limit, long windowMs) {}
