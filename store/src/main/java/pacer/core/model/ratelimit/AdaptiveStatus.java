package pacer.core.model.ratelimit;

/**
 * Adaptive allocation details reported alongside a {@link RateLimitStatus}.
 *
 * @param userReserved capacity reserved for user requests
 * @param backgroundMax capacity available to background requests
 * @param backgroundPaused whether background requests are currently refused
 * @param recentUserActivity user requests inside the monitoring window
 * @param reason description of the allocation strategy in effect
 * @param priority the priority the status was requested for
 * @param priorityRemaining requests of {@code priority} still allowed under its share, zero while paused
 */
public record AdaptiveStatus(
        int userReserved,
        int backgroundMax,
        boolean backgroundPaused,
        int recentUserActivity,
        String reason,
        Priority priority,
        long priorityRemaining) {

    static AdaptiveStatus of(CapacitySnapshot snapshot, int recentUserActivity, Priority priority, long priorityCount) {
        final long priorityRemaining =
                snapshot.isPaused(priority) ? 0 : Math.max(0, snapshot.limitFor(priority) - priorityCount);
        return new AdaptiveStatus(
                snapshot.userReserved(),
                snapshot.backgroundMax(),
                snapshot.backgroundPaused(),
                recentUserActivity,
                snapshot.reason(),
                priority,
                priorityRemaining);
    }
}
