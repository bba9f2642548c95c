package pacer.core.model.ratelimit;

/**
 * Shape of recent user activity within the monitoring window.
 */
public enum ActivityTrend {
    NONE,
    STABLE,
    INCREASING,
    DECREASING
}
