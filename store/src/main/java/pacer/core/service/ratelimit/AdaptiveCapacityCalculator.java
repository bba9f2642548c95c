package pacer.core.service.ratelimit;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.jboss.logging.Logger;

import pacer.core.config.AdaptiveConfig;
import pacer.core.model.ratelimit.ActivityMetrics;
import pacer.core.model.ratelimit.ActivityTrend;
import pacer.core.model.ratelimit.CapacitySnapshot;
import pacer.core.model.ratelimit.Priority;

/**
 * Splits a resource's limit between user and background traffic.
 *
 * <p>Strategies, first match wins:
 * <ol>
 *   <li>Initial state: nothing recorded yet, 30% reserved for users.</li>
 *   <li>Sustained zero activity: the last user request is older than the inactivity
 *       threshold, everything goes to background.</li>
 *   <li>No recent user activity: users keep the minimum reservation.</li>
 *   <li>High user activity: users get most of the limit; background pauses while
 *       the user trend is increasing, if configured.</li>
 *   <li>Moderate or low activity: user capacity scales with the recent request count.</li>
 * </ol>
 *
 * <p>Snapshots are cached per resource and reused until the recalculation interval has
 * passed. The cache belongs to this instance only.
 */
public final class AdaptiveCapacityCalculator {

    private static final Logger LOG = Logger.getLogger(AdaptiveCapacityCalculator.class);

    static final double INITIAL_USER_SHARE = 0.3;
    static final double BASE_USER_SHARE = 0.4;
    static final double MAX_DYNAMIC_USER_SHARE = 0.7;
    static final double HIGH_ACTIVITY_BASE_SHARE = 0.5;
    static final double MAX_HIGH_ACTIVITY_USER_SHARE = 0.9;
    static final double REQUESTS_PER_SCALING_STEP = 5.0;

    private final AdaptiveConfig config;
    private final ActivityMetricsTracker tracker;
    private final ConcurrentMap<String, CapacitySnapshot> snapshots = new ConcurrentHashMap<>();

    public AdaptiveCapacityCalculator(AdaptiveConfig config, ActivityMetricsTracker tracker) {
        this.config = config;
        this.tracker = tracker;
    }

    /**
     * Current allocation of a resource, recalculated only when the cached one is stale.
     */
    public CapacitySnapshot snapshot(String resource, int limit, ActivityMetrics metrics, long now) {
        final var cached = snapshots.get(resource);
        if (cached != null && cached.isFresh(now, config.recalculationIntervalMs(), limit)) {
            return cached;
        }

        tracker.refresh(metrics, now);
        final var snapshot = calculate(limit, metrics, now);
        snapshots.put(resource, snapshot);
        LOG.debugf(
                "Capacity of %s: user=%d background=%d paused=%s (%s)",
                resource, snapshot.userReserved(), snapshot.backgroundMax(), snapshot.backgroundPaused(),
                snapshot.reason());
        return snapshot;
    }

    /**
     * Compute an allocation without touching the cache.
     *
     * <p>The user trend is read from {@code metrics} as classified by the tracker.
     */
    public CapacitySnapshot calculate(int limit, ActivityMetrics metrics, long now) {
        if (metrics.isEmpty()) {
            final var userReserved = clamp((int) Math.round(limit * INITIAL_USER_SHARE), limit);
            return split(limit, userReserved, false, "Initial state: no activity recorded yet", now);
        }

        final var recentUserRequests = tracker.recentUserRequests(metrics, now);
        final var lastUserRequest = metrics.lastUserRequest();

        if (recentUserRequests == 0
                && lastUserRequest.isPresent()
                && now - lastUserRequest.getAsLong() > config.sustainedInactivityThresholdMs()) {
            final var idleSeconds = (now - lastUserRequest.getAsLong()) / 1000;
            return split(
                    limit,
                    0,
                    false,
                    "Sustained zero activity for %ds, full capacity released to background".formatted(idleSeconds),
                    now);
        }

        if (recentUserRequests == 0) {
            return split(
                    limit,
                    clamp(config.minUserReserved(), limit),
                    false,
                    "No recent user activity, keeping minimum user reservation",
                    now);
        }

        if (recentUserRequests >= config.highActivityThreshold()) {
            final var trend = metrics.userActivityTrend();
            final var userCapacity = (int) Math.min(
                    Math.floor(limit * MAX_HIGH_ACTIVITY_USER_SHARE),
                    Math.floor(limit * HIGH_ACTIVITY_BASE_SHARE * config.maxUserScaling()));
            final var userReserved = clamp(Math.max(config.minUserReserved(), userCapacity), limit);
            final var paused = config.backgroundPauseOnIncreasingTrend() && trend == ActivityTrend.INCREASING;
            final var reason = paused
                    ? "High user activity (%d requests), background paused on increasing trend"
                            .formatted(recentUserRequests)
                    : "High user activity (%d requests), trend %s"
                            .formatted(recentUserRequests, trend.name().toLowerCase(Locale.ROOT));
            return split(limit, userReserved, paused, reason, now);
        }

        final var baseUserCapacity = Math.floor(limit * BASE_USER_SHARE);
        final var userMultiplier =
                Math.min(config.maxUserScaling(), 1 + recentUserRequests / REQUESTS_PER_SCALING_STEP);
        final var dynamicUserCapacity =
                (int) Math.min(Math.floor(limit * MAX_DYNAMIC_USER_SHARE), Math.floor(baseUserCapacity * userMultiplier));
        final var userReserved = clamp(Math.max(config.minUserReserved(), dynamicUserCapacity), limit);
        final var level = recentUserRequests >= config.moderateActivityThreshold() ? "Moderate" : "Low";
        return split(
                limit,
                userReserved,
                false,
                String.format(
                        Locale.ROOT,
                        "%s user activity (%d requests), dynamic scaling x%.2f",
                        level,
                        recentUserRequests,
                        userMultiplier),
                now);
    }

    /**
     * Effective limit of a priority under the given snapshot, zero while paused.
     */
    public static int effectiveLimit(CapacitySnapshot snapshot, Priority priority) {
        return snapshot.isPaused(priority) ? 0 : snapshot.limitFor(priority);
    }

    public void invalidate(String resource) {
        snapshots.remove(resource);
    }

    public void clear() {
        snapshots.clear();
    }

    private static CapacitySnapshot split(int limit, int userReserved, boolean paused, String reason, long now) {
        return new CapacitySnapshot(limit, userReserved, limit - userReserved, paused, reason, now);
    }

    private static int clamp(int value, int limit) {
        return Math.max(0, Math.min(limit, value));
    }
}
