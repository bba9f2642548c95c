package pacer.core.model.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import pacer.core.exception.InvalidResourceKeyException;

@DisplayName("ResourceKeyCodec")
class ResourceKeyCodecTest {

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should reject empty resources")
        void shouldRejectEmptyResource() {
            var error = assertThrows(InvalidResourceKeyException.class, () -> ResourceKeyCodec.validateResource(""));
            assertEquals("resource must not be empty", error.getMessage());

            assertThrows(InvalidResourceKeyException.class, () -> ResourceKeyCodec.validateResource(null));
        }

        @Test
        @DisplayName("should accept 512 characters and reject 513")
        void shouldEnforceMaximumLength() {
            var longest = "r".repeat(512);

            assertEquals(longest, ResourceKeyCodec.validateResource(longest));
            var error = assertThrows(
                    InvalidResourceKeyException.class, () -> ResourceKeyCodec.validateResource(longest + "r"));
            assertEquals("resource exceeds maximum length of 512 characters", error.getMessage());
        }

        @Test
        @DisplayName("should reject control characters")
        void shouldRejectControlCharacters() {
            var error = assertThrows(
                    InvalidResourceKeyException.class, () -> ResourceKeyCodec.validateResource("api\nexample"));
            assertEquals("resource must not contain control characters", error.getMessage());
        }

        @Test
        @DisplayName("should label origin errors as origin")
        void shouldLabelOriginErrors() {
            var error = assertThrows(InvalidResourceKeyException.class, () -> ResourceKeyCodec.validateOrigin(""));
            assertEquals("origin must not be empty", error.getMessage());
        }
    }

    @Nested
    @DisplayName("Key layout")
    class KeyLayoutTests {

        @Test
        @DisplayName("should build record, index, slot and cooldown keys")
        void shouldBuildKeys() {
            assertEquals("RATELIMIT#api", ResourceKeyCodec.partitionKey("api"));
            assertEquals("RATELIMIT#api#user", ResourceKeyCodec.priorityIndexKey("api", Priority.USER));
            assertEquals("RATELIMIT_SLOT#api", ResourceKeyCodec.slotPartitionKey("api"));
            assertEquals("TS#1700000000000#abc", ResourceKeyCodec.recordSortKey(1_700_000_000_000L, "abc"));
            assertEquals("SLOT#3", ResourceKeyCodec.slotSortKey(SlotClaim.DEFAULT_SCOPE, 3));
            assertEquals("SLOT#background#3", ResourceKeyCodec.slotSortKey("background", 3));
            assertEquals("COOLDOWN#api.example.com", ResourceKeyCodec.cooldownKey("api.example.com"));
        }

        @Test
        @DisplayName("should sort record keys between the window bounds")
        void shouldSortRecordKeysBetweenBounds() {
            var key = ResourceKeyCodec.recordSortKey(1_700_000_000_500L, "abc");

            assertTrue(key.compareTo(ResourceKeyCodec.recordSortLowerBound(1_700_000_000_500L)) >= 0);
            assertTrue(key.compareTo(ResourceKeyCodec.recordSortLowerBound(1_700_000_000_501L)) < 0);
            assertTrue(key.compareTo(ResourceKeyCodec.RECORD_SORT_UPPER_BOUND) < 0);
        }

        @Test
        @DisplayName("should fall back to the start of the record range for short bounds")
        void shouldFallBackForShortBounds() {
            assertEquals("TS#", ResourceKeyCodec.recordSortLowerBound(0));
            assertEquals("TS#", ResourceKeyCodec.recordSortLowerBound(-5));
            assertEquals("TS#", ResourceKeyCodec.recordSortLowerBound(999_999_999_999L));
        }
    }
}
