package pacer.core.model.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.OptionalLong;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ActivityMetrics")
class ActivityMetricsTest {

    @Test
    @DisplayName("should drop the oldest entries past the sample cap")
    void shouldTrimOldestOnOverflow() {
        var metrics = new ActivityMetrics(3);
        for (long t = 1; t <= 5; t++) {
            metrics.add(Priority.BACKGROUND, t);
        }

        assertEquals(List.of(3L, 4L, 5L), metrics.backgroundRequests());
    }

    @Test
    @DisplayName("should remember the last user request after pruning")
    void shouldRememberLastUserRequest() {
        var metrics = new ActivityMetrics(10);
        metrics.add(Priority.USER, 100);

        metrics.pruneBefore(500);

        assertTrue(metrics.userRequests().isEmpty());
        assertEquals(OptionalLong.of(100), metrics.lastUserRequest());
        assertFalse(metrics.isEmpty());
    }

    @Test
    @DisplayName("should count within half-open ranges")
    void shouldCountWithinRanges() {
        var metrics = new ActivityMetrics(10);
        metrics.add(Priority.USER, 10);
        metrics.add(Priority.USER, 20);
        metrics.add(Priority.USER, 30);

        assertEquals(2, metrics.countSince(Priority.USER, 20));
        assertEquals(1, metrics.countBetween(Priority.USER, 10, 20));
        assertEquals(0, metrics.countSince(Priority.BACKGROUND, 0));
    }
}
