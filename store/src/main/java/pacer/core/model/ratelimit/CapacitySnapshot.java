package pacer.core.model.ratelimit;

/**
 * Current split of a resource's limit between user and background traffic.
 *
 * @param limit the resource limit the split was computed for
 * @param userReserved capacity reserved for user requests
 * @param backgroundMax capacity available to background requests
 * @param backgroundPaused whether background requests are refused outright
 * @param reason human-readable description of the strategy that produced this split
 * @param computedAt epoch milliseconds of the calculation
 */
public record CapacitySnapshot(
        int limit, int userReserved, int backgroundMax, boolean backgroundPaused, String reason, long computedAt) {

    public CapacitySnapshot {
        if (userReserved < 0 || backgroundMax < 0) {
            throw new IllegalArgumentException("capacities must be non-negative");
        }
        if (userReserved + backgroundMax > limit) {
            throw new IllegalArgumentException("userReserved + backgroundMax must not exceed limit");
        }
    }

    /**
     * Effective limit for the given priority.
     */
    public int limitFor(Priority priority) {
        return priority == Priority.USER ? userReserved : backgroundMax;
    }

    /**
     * Whether requests of the given priority are refused regardless of remaining count.
     */
    public boolean isPaused(Priority priority) {
        return priority == Priority.BACKGROUND && backgroundPaused;
    }

    /**
     * Whether this snapshot may still be reused at {@code now}.
     */
    public boolean isFresh(long now, long recalculationIntervalMs, int currentLimit) {
        return currentLimit == limit && now - computedAt < recalculationIntervalMs;
    }
}
