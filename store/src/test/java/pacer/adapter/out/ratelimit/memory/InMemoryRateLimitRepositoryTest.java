package pacer.adapter.out.ratelimit.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import pacer.core.model.ratelimit.Cooldown;
import pacer.core.model.ratelimit.RequestRecord;
import pacer.core.model.ratelimit.SlotClaim;
import pacer.core.port.out.CooldownRepository;
import pacer.core.port.out.RateLimitRepository;
import pacer.core.port.out.RateLimitRepositoryContractTest;
import pacer.core.port.out.StoreCapability;

@DisplayName("InMemoryRateLimitRepository")
class InMemoryRateLimitRepositoryTest extends RateLimitRepositoryContractTest {

    private InMemoryRateLimitRepository inMemory;

    @Override
    protected RateLimitRepository createRepository() {
        inMemory = new InMemoryRateLimitRepository();
        return inMemory;
    }

    @Override
    protected CooldownRepository createCooldownRepository() {
        return new InMemoryCooldownRepository();
    }

    @Nested
    @DisplayName("Statistics and cleanup")
    class StatisticsAndCleanupTests {

        @Test
        @DisplayName("should declare statistics and explicit cleanup")
        void shouldDeclareCapabilities() {
            assertEquals(
                    Set.of(StoreCapability.STATISTICS, StoreCapability.EXPLICIT_CLEANUP), inMemory.capabilities());
        }

        @Test
        @DisplayName("should count stored records per resource")
        void shouldCountByResource() {
            await(inMemory.insert(RequestRecord.create("a", now, null), CONFIG));
            await(inMemory.insert(RequestRecord.create("a", now - 120_000, null), CONFIG));
            await(inMemory.insert(RequestRecord.create("b", now, null), CONFIG));

            assertEquals(Map.of("a", 2L, "b", 1L), await(inMemory.countByResource()));
            assertEquals(Set.of("a", "b"), await(inMemory.findResources()));
        }

        @Test
        @DisplayName("should delete records older than the cutoff and drop empty resources")
        void shouldDeleteOlderThanCutoff() {
            await(inMemory.insert(RequestRecord.create("a", now - 120_000, null), CONFIG));
            await(inMemory.insert(RequestRecord.create("a", now, null), CONFIG));
            await(inMemory.insert(RequestRecord.create("b", now - 120_000, null), CONFIG));

            assertEquals(1L, await(inMemory.deleteOlderThan("a", now - 60_000)));
            assertEquals(1L, await(inMemory.deleteOlderThan("b", now - 60_000)));

            assertEquals(Set.of("a"), await(inMemory.findResources()));
        }

        @Test
        @DisplayName("should delete expired slots only")
        void shouldDeleteExpiredSlots() {
            await(inMemory.claimSlot(
                    new SlotClaim("a", SlotClaim.DEFAULT_SCOPE, 0, now - 60_000, now),
                    RequestRecord.create("a", now - 60_000, null),
                    CONFIG));
            await(inMemory.claimSlot(
                    new SlotClaim("a", SlotClaim.DEFAULT_SCOPE, 1, now, now + 60_000),
                    RequestRecord.create("a", now, null),
                    CONFIG));

            assertEquals(1L, await(inMemory.deleteExpiredSlots(now)));
            assertEquals(1, inMemory.slotCount("a"));
        }
    }

    @Nested
    @DisplayName("Cooldown expiry")
    class CooldownExpiryTests {

        @Test
        @DisplayName("should delete cooldowns that have passed")
        void shouldDeleteExpiredCooldowns() {
            var cooldowns = new InMemoryCooldownRepository();
            await(cooldowns.save(new Cooldown("expired", now - 1), now));
            await(cooldowns.save(new Cooldown("active", now + 60_000), now));

            assertEquals(1L, await(cooldowns.deleteExpired(now)));

            assertEquals(Optional.empty(), await(cooldowns.find("expired")));
            assertTrue(await(cooldowns.find("active")).isPresent());
        }
    }
}
