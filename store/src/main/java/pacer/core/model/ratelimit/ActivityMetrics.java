package pacer.core.model.ratelimit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalLong;

/**
 * Bounded recent-request history of one resource, split by priority.
 *
 * <p>Timestamps are kept oldest first. When a list grows past the sample cap the
 * oldest entries are dropped. The latest user request is remembered even after it
 * has been pruned, so long idle periods stay detectable. Instances are safe for
 * concurrent use.
 */
public final class ActivityMetrics {

    private final int maxSamples;
    private final Deque<Long> userRequests = new ArrayDeque<>();
    private final Deque<Long> backgroundRequests = new ArrayDeque<>();
    private ActivityTrend userActivityTrend = ActivityTrend.NONE;
    private OptionalLong lastUserRequest = OptionalLong.empty();

    public ActivityMetrics(int maxSamples) {
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be positive");
        }
        this.maxSamples = maxSamples;
    }

    /**
     * Append a request timestamp for the given priority, trimming the oldest on overflow.
     */
    public synchronized void add(Priority priority, long timestamp) {
        final var requests = requestsFor(priority);
        requests.addLast(timestamp);
        if (priority == Priority.USER
                && (lastUserRequest.isEmpty() || lastUserRequest.getAsLong() < timestamp)) {
            lastUserRequest = OptionalLong.of(timestamp);
        }
        while (requests.size() > maxSamples) {
            requests.removeFirst();
        }
    }

    /**
     * Drop every timestamp strictly before {@code cutoff}.
     */
    public synchronized void pruneBefore(long cutoff) {
        prune(userRequests, cutoff);
        prune(backgroundRequests, cutoff);
    }

    /**
     * Count requests of the given priority at or after {@code fromInclusive}.
     */
    public synchronized int countSince(Priority priority, long fromInclusive) {
        int count = 0;
        for (long timestamp : requestsFor(priority)) {
            if (timestamp >= fromInclusive) {
                count++;
            }
        }
        return count;
    }

    /**
     * Count requests of the given priority in {@code [fromInclusive, toExclusive)}.
     */
    public synchronized int countBetween(Priority priority, long fromInclusive, long toExclusive) {
        int count = 0;
        for (long timestamp : requestsFor(priority)) {
            if (timestamp >= fromInclusive && timestamp < toExclusive) {
                count++;
            }
        }
        return count;
    }

    /**
     * Timestamp of the latest user request ever added, pruned or not.
     */
    public synchronized OptionalLong lastUserRequest() {
        return lastUserRequest;
    }

    /**
     * Whether no user request was ever seen and no background request is retained.
     */
    public synchronized boolean isEmpty() {
        return lastUserRequest.isEmpty() && userRequests.isEmpty() && backgroundRequests.isEmpty();
    }

    public synchronized List<Long> userRequests() {
        return List.copyOf(new ArrayList<>(userRequests));
    }

    public synchronized List<Long> backgroundRequests() {
        return List.copyOf(new ArrayList<>(backgroundRequests));
    }

    public synchronized ActivityTrend userActivityTrend() {
        return userActivityTrend;
    }

    public synchronized void userActivityTrend(ActivityTrend trend) {
        this.userActivityTrend = trend;
    }

    public int maxSamples() {
        return maxSamples;
    }

    private Deque<Long> requestsFor(Priority priority) {
        return priority == Priority.USER ? userRequests : backgroundRequests;
    }

    private static void prune(Deque<Long> requests, long cutoff) {
        requests.removeIf(timestamp -> timestamp < cutoff);
    }
}
