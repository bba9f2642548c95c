package pacer.core.model.ratelimit;

import java.util.List;

/**
 * Store-wide counters.
 *
 * @param totalRequests stored request records, including ones not yet cleaned up
 * @param uniqueResources resources with at least one stored record
 * @param rateLimitedResources resources whose window is currently full
 */
public record RateLimitStats(long totalRequests, int uniqueResources, List<String> rateLimitedResources) {

    public RateLimitStats {
        rateLimitedResources = rateLimitedResources == null ? List.of() : List.copyOf(rateLimitedResources);
    }
}
