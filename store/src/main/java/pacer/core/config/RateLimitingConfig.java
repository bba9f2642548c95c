package pacer.core.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the rate limit store.
 *
 * <p>Configuration prefix: {@code pacer.rate-limit}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code PACER_RATE_LIMIT_DEFAULT_LIMIT} - Requests per window for unconfigured resources</li>
 *   <li>{@code PACER_RATE_LIMIT_DEFAULT_WINDOW} - Window for unconfigured resources (ISO-8601)</li>
 *   <li>{@code PACER_RATE_LIMIT_STORE_PROVIDER} - Backend: memory, sqlite, cassandra</li>
 *   <li>{@code PACER_RATE_LIMIT_ADAPTIVE_ENABLED} - Split capacity between user and background traffic</li>
 * </ul>
 */
@ConfigMapping(prefix = "pacer.rate-limit")
public interface RateLimitingConfig {

    /**
     * Default requests per window for resources without explicit configuration.
     *
     * <p>Zero blocks every request.
     *
     * @return default limit (default: 60)
     */
    @WithDefault("60")
    int defaultLimit();

    /**
     * Default window length.
     *
     * @return window (default: 1 minute)
     */
    @WithDefault("PT1M")
    Duration defaultWindow();

    /**
     * Interval of the background cleanup pass for backends without native expiry.
     *
     * <p>A zero duration disables the scheduled pass; {@code cleanup()} may still be called.
     *
     * @return cleanup interval (default: 1 minute)
     */
    @WithDefault("PT1M")
    Duration cleanupInterval();

    /**
     * Per-resource limits applied at construction, keyed by resource.
     */
    Map<String, ResourceLimit> resources();

    /**
     * Backend selection.
     */
    StoreConfig store();

    /**
     * Adaptive priority allocation.
     */
    AdaptiveConfigMapping adaptive();

    /**
     * Limit of a single resource.
     */
    interface ResourceLimit {

        int limit();

        Duration window();
    }

    interface StoreConfig {

        /**
         * Name of the store provider to use.
         *
         * <p>When absent the highest-priority available provider is selected.
         *
         * @return provider name (memory, sqlite, cassandra)
         */
        Optional<String> provider();
    }

    /**
     * Tuning of the adaptive capacity calculator.
     */
    interface AdaptiveConfigMapping {

        /**
         * Build the adaptive store instead of the plain sliding window store.
         *
         * @return true to enable (default: false)
         */
        @WithDefault("false")
        boolean enabled();

        /**
         * Window over which recent activity is counted.
         *
         * @return monitoring window (default: 15 minutes)
         */
        @WithDefault("PT15M")
        Duration monitoringWindow();

        /**
         * User requests in the monitoring window at which activity counts as high.
         *
         * @return threshold (default: 10)
         */
        @WithDefault("10")
        int highActivityThreshold();

        /**
         * User requests in the monitoring window at which activity counts as moderate.
         *
         * @return threshold (default: 3)
         */
        @WithDefault("3")
        int moderateActivityThreshold();

        /**
         * Minimum time between two capacity calculations of a resource.
         *
         * @return interval (default: 30 seconds)
         */
        @WithDefault("PT30S")
        Duration recalculationInterval();

        /**
         * Idle time after which all capacity is handed to background traffic.
         *
         * @return threshold (default: 30 minutes)
         */
        @WithDefault("PT30M")
        Duration sustainedInactivityThreshold();

        /**
         * Pause background traffic when user activity is high and still rising.
         *
         * @return true to pause (default: true)
         */
        @WithDefault("true")
        boolean backgroundPauseOnIncreasingTrend();

        /**
         * Upper bound of the user capacity multiplier.
         *
         * @return multiplier (default: 2.0)
         */
        @WithDefault("2.0")
        double maxUserScaling();

        /**
         * Capacity always reserved for user traffic once any user activity exists.
         *
         * @return minimum reservation (default: 5)
         */
        @WithDefault("5")
        int minUserReserved();
    }
}
