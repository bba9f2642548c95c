package pacer.core.service.ratelimit;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import pacer.core.config.AdaptiveConfig;
import pacer.core.model.ratelimit.ActivityMetrics;
import pacer.core.model.ratelimit.ActivityTrend;
import pacer.core.model.ratelimit.Priority;
import pacer.core.port.out.RateLimitRepository;

/**
 * Recent activity per resource, owned by one store instance.
 *
 * <p>Metrics are created on first use and hydrated from persisted records, so a
 * restarted process does not start from an empty history.
 */
public final class ActivityMetricsTracker {

    private static final Logger LOG = Logger.getLogger(ActivityMetricsTracker.class);

    private static final double INCREASING_RATIO = 1.5;
    private static final double DECREASING_RATIO = 0.5;

    private final RateLimitRepository repository;
    private final AdaptiveConfig config;
    private final ConcurrentMap<String, ActivityMetrics> metrics = new ConcurrentHashMap<>();

    public ActivityMetricsTracker(RateLimitRepository repository, AdaptiveConfig config) {
        this.repository = repository;
        this.config = config;
    }

    /**
     * Metrics of a resource, loading them from storage on first access.
     *
     * <p>Hydration reaches back far enough to detect sustained inactivity and keeps
     * at most the newest {@link AdaptiveConfig#maxMetricSamples()} entries per priority.
     */
    public Uni<ActivityMetrics> ensureLoaded(String resource, long now) {
        final var existing = metrics.get(resource);
        if (existing != null) {
            return Uni.createFrom().item(existing);
        }

        final var lookback = Math.max(config.monitoringWindowMs(), config.sustainedInactivityThresholdMs());
        final var since = now - lookback;
        final var samples = config.maxMetricSamples();

        return Uni.combine()
                .all()
                .unis(
                        repository.findRecentTimestamps(resource, Priority.USER, since, samples),
                        repository.findRecentTimestamps(resource, Priority.BACKGROUND, since, samples))
                .asTuple()
                .map(loaded -> {
                    final var hydrated = hydrate(loaded.getItem1(), loaded.getItem2(), now);
                    final var winner = metrics.putIfAbsent(resource, hydrated);
                    if (winner != null) {
                        return winner;
                    }
                    LOG.debugf(
                            "Hydrated activity of %s: %d user, %d background requests",
                            resource, loaded.getItem1().size(), loaded.getItem2().size());
                    return hydrated;
                });
    }

    /**
     * Append a request to the history of a resource.
     */
    public void record(ActivityMetrics resourceMetrics, Priority priority, long timestamp) {
        resourceMetrics.add(priority, timestamp);
        refresh(resourceMetrics, timestamp);
    }

    /**
     * Drop entries that left the monitoring window and reclassify the user trend.
     */
    public void refresh(ActivityMetrics resourceMetrics, long now) {
        resourceMetrics.pruneBefore(monitoringStart(now));
        resourceMetrics.userActivityTrend(classifyTrend(resourceMetrics, now));
    }

    /**
     * User requests inside the monitoring window.
     */
    public int recentUserRequests(ActivityMetrics resourceMetrics, long now) {
        return resourceMetrics.countSince(Priority.USER, monitoringStart(now));
    }

    /**
     * Compare user request density in the older and newer half of the monitoring window.
     */
    public ActivityTrend classifyTrend(ActivityMetrics resourceMetrics, long now) {
        final var midpoint = now - config.monitoringWindowMs() / 2;
        final var previous = resourceMetrics.countBetween(Priority.USER, monitoringStart(now), midpoint);
        final var recent = resourceMetrics.countBetween(Priority.USER, midpoint, now + 1);

        if (previous == 0 && recent == 0) {
            return ActivityTrend.NONE;
        }
        if (recent > previous * INCREASING_RATIO) {
            return ActivityTrend.INCREASING;
        }
        if (recent < previous * DECREASING_RATIO) {
            return ActivityTrend.DECREASING;
        }
        return ActivityTrend.STABLE;
    }

    public void forget(String resource) {
        metrics.remove(resource);
    }

    public void clear() {
        metrics.clear();
    }

    /**
     * Number of resources with metrics in memory.
     */
    public int trackedResources() {
        return metrics.size();
    }

    private ActivityMetrics hydrate(List<Long> userTimestamps, List<Long> backgroundTimestamps, long now) {
        final var hydrated = new ActivityMetrics(config.maxMetricSamples());
        userTimestamps.forEach(timestamp -> hydrated.add(Priority.USER, timestamp));
        backgroundTimestamps.forEach(timestamp -> hydrated.add(Priority.BACKGROUND, timestamp));
        refresh(hydrated, now);
        return hydrated;
    }

    private long monitoringStart(long now) {
        return now - config.monitoringWindowMs() + 1;
    }
}
