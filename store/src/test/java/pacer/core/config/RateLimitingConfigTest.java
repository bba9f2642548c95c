package pacer.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RateLimitingConfig")
class RateLimitingConfigTest {

    static RateLimitingConfig mapping(Map<String, String> properties) {
        return new SmallRyeConfigBuilder()
                .withMapping(RateLimitingConfig.class)
                .withSources(new PropertiesConfigSource(properties, "test", 500))
                .build()
                .getConfigMapping(RateLimitingConfig.class);
    }

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("should apply defaults when nothing is configured")
        void shouldApplyDefaults() {
            var config = mapping(Map.of());

            assertEquals(60, config.defaultLimit());
            assertEquals(Duration.ofMinutes(1), config.defaultWindow());
            assertEquals(Duration.ofMinutes(1), config.cleanupInterval());
            assertEquals(Optional.empty(), config.store().provider());
            assertTrue(config.resources().isEmpty());
            assertFalse(config.adaptive().enabled());
        }

        @Test
        @DisplayName("should map adaptive defaults to the default tuning")
        void shouldMapAdaptiveDefaults() {
            assertEquals(AdaptiveConfig.defaults(), AdaptiveConfig.from(mapping(Map.of()).adaptive()));
        }
    }

    @Nested
    @DisplayName("Overrides")
    class OverrideTests {

        @Test
        @DisplayName("should read store and per-resource settings")
        void shouldReadOverrides() {
            var config = mapping(Map.of(
                    "pacer.rate-limit.default-limit", "10",
                    "pacer.rate-limit.default-window", "PT5S",
                    "pacer.rate-limit.store.provider", "sqlite",
                    "pacer.rate-limit.resources.api.limit", "3",
                    "pacer.rate-limit.resources.api.window", "PT1S"));

            assertEquals(10, config.defaultLimit());
            assertEquals(Duration.ofSeconds(5), config.defaultWindow());
            assertEquals(Optional.of("sqlite"), config.store().provider());
            assertEquals(3, config.resources().get("api").limit());
            assertEquals(Duration.ofSeconds(1), config.resources().get("api").window());
        }

        @Test
        @DisplayName("should convert adaptive durations to milliseconds")
        void shouldConvertAdaptiveSettings() {
            var config = mapping(Map.of(
                    "pacer.rate-limit.adaptive.enabled", "true",
                    "pacer.rate-limit.adaptive.monitoring-window", "PT1S",
                    "pacer.rate-limit.adaptive.high-activity-threshold", "5",
                    "pacer.rate-limit.adaptive.moderate-activity-threshold", "2",
                    "pacer.rate-limit.adaptive.recalculation-interval", "PT0.1S",
                    "pacer.rate-limit.adaptive.sustained-inactivity-threshold", "PT2S",
                    "pacer.rate-limit.adaptive.min-user-reserved", "10"));

            assertTrue(config.adaptive().enabled());
            assertEquals(
                    new AdaptiveConfig(1000, 5, 2, 100, 2000, true, 2.0, 10),
                    AdaptiveConfig.from(config.adaptive()));
        }
    }

    @Nested
    @DisplayName("AdaptiveConfig validation")
    class ValidationTests {

        @Test
        @DisplayName("should reject a moderate threshold above the high threshold")
        void shouldRejectInvertedThresholds() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new AdaptiveConfig(1000, 2, 5, 100, 2000, true, 2.0, 10));
        }

        @Test
        @DisplayName("should reject scaling below one")
        void shouldRejectShrinkingScale() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new AdaptiveConfig(1000, 5, 2, 100, 2000, true, 0.5, 10));
        }

        @Test
        @DisplayName("should reject an empty monitoring window")
        void shouldRejectEmptyMonitoringWindow() {
            assertThrows(
                    IllegalArgumentException.class, () -> new AdaptiveConfig(0, 5, 2, 100, 2000, true, 2.0, 10));
        }

        @Test
        @DisplayName("should keep enough samples for high activity detection")
        void shouldSizeMetricSamples() {
            assertEquals(200, AdaptiveConfig.defaults().maxMetricSamples());
            assertEquals(100, new AdaptiveConfig(1000, 2, 1, 100, 2000, true, 2.0, 10).maxMetricSamples());
        }
    }
}
