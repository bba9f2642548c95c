package pacer.core.config;

/**
 * Tuning of the adaptive capacity calculator, in milliseconds.
 *
 * @param monitoringWindowMs window over which recent activity is counted
 * @param highActivityThreshold user requests at which activity counts as high
 * @param moderateActivityThreshold user requests at which activity counts as moderate
 * @param recalculationIntervalMs minimum time between two calculations of a resource
 * @param sustainedInactivityThresholdMs idle time after which background gets the full limit
 * @param backgroundPauseOnIncreasingTrend pause background when high user activity keeps rising
 * @param maxUserScaling upper bound of the user capacity multiplier
 * @param minUserReserved capacity reserved for users once any user activity exists
 */
public record AdaptiveConfig(
        long monitoringWindowMs,
        int highActivityThreshold,
        int moderateActivityThreshold,
        long recalculationIntervalMs,
        long sustainedInactivityThresholdMs,
        boolean backgroundPauseOnIncreasingTrend,
        double maxUserScaling,
        int minUserReserved) {

    private static final int MIN_METRIC_SAMPLES = 100;
    private static final int SAMPLES_PER_HIGH_ACTIVITY_REQUEST = 20;

    public AdaptiveConfig {
        if (monitoringWindowMs <= 0) {
            throw new IllegalArgumentException("monitoringWindowMs must be positive");
        }
        if (highActivityThreshold <= 0 || moderateActivityThreshold < 0) {
            throw new IllegalArgumentException("activity thresholds must be positive");
        }
        if (moderateActivityThreshold > highActivityThreshold) {
            throw new IllegalArgumentException("moderateActivityThreshold must not exceed highActivityThreshold");
        }
        if (recalculationIntervalMs < 0 || sustainedInactivityThresholdMs < 0) {
            throw new IllegalArgumentException("intervals must be non-negative");
        }
        if (maxUserScaling < 1.0) {
            throw new IllegalArgumentException("maxUserScaling must be at least 1.0");
        }
        if (minUserReserved < 0) {
            throw new IllegalArgumentException("minUserReserved must be non-negative");
        }
    }

    /**
     * Defaults matching {@link RateLimitingConfig.AdaptiveConfigMapping}.
     */
    public static AdaptiveConfig defaults() {
        return new AdaptiveConfig(15 * 60_000L, 10, 3, 30_000L, 30 * 60_000L, true, 2.0, 5);
    }

    public static AdaptiveConfig from(RateLimitingConfig.AdaptiveConfigMapping mapping) {
        return new AdaptiveConfig(
                mapping.monitoringWindow().toMillis(),
                mapping.highActivityThreshold(),
                mapping.moderateActivityThreshold(),
                mapping.recalculationInterval().toMillis(),
                mapping.sustainedInactivityThreshold().toMillis(),
                mapping.backgroundPauseOnIncreasingTrend(),
                mapping.maxUserScaling(),
                mapping.minUserReserved());
    }

    /**
     * Per-priority history cap kept for each resource.
     */
    public int maxMetricSamples() {
        return Math.max(MIN_METRIC_SAMPLES, highActivityThreshold * SAMPLES_PER_HIGH_ACTIVITY_REQUEST);
    }
}
