package pacer.adapter.out.ratelimit.memory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;

import pacer.core.exception.SlotClaimConflictException;
import pacer.core.model.ratelimit.Priority;
import pacer.core.model.ratelimit.RateLimitConfig;
import pacer.core.model.ratelimit.RequestRecord;
import pacer.core.model.ratelimit.SlotClaim;
import pacer.core.port.out.RateLimitRepository;
import pacer.core.port.out.StoreCapability;

/**
 * In-memory implementation of RateLimitRepository.
 *
 * <p>All state sits behind one lock, which makes slot claims a plain
 * check-and-insert. State is lost on restart and not shared across instances.
 */
public class InMemoryRateLimitRepository implements RateLimitRepository {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ResourceLog> resources = new HashMap<>();

    @Override
    public Set<StoreCapability> capabilities() {
        return EnumSet.of(StoreCapability.STATISTICS, StoreCapability.EXPLICIT_CLEANUP);
    }

    @Override
    public Uni<Void> insert(RequestRecord record, RateLimitConfig config) {
        return locked(() -> {
            logOf(record.resource()).records.add(record);
            return null;
        });
    }

    @Override
    public Uni<Long> countSince(String resource, Priority priority, long fromInclusive) {
        return locked(() -> {
            final var log = resources.get(resource);
            if (log == null) {
                return 0L;
            }
            return log.records.stream()
                    .filter(record -> matches(record, priority, fromInclusive))
                    .count();
        });
    }

    @Override
    public Uni<Optional<Long>> findOldestSince(String resource, Priority priority, long fromInclusive) {
        return locked(() -> {
            final var log = resources.get(resource);
            if (log == null) {
                return Optional.<Long>empty();
            }
            return log.records.stream()
                    .filter(record -> matches(record, priority, fromInclusive))
                    .map(RequestRecord::timestamp)
                    .min(Long::compare);
        });
    }

    @Override
    public Uni<List<Long>> findRecentTimestamps(
            String resource, Priority priority, long fromInclusive, int maxResults) {
        return locked(() -> {
            final var log = resources.get(resource);
            if (log == null) {
                return List.<Long>of();
            }
            final var timestamps = log.records.stream()
                    .filter(record -> matches(record, priority, fromInclusive))
                    .map(RequestRecord::timestamp)
                    .sorted()
                    .toList();
            return timestamps.subList(Math.max(0, timestamps.size() - maxResults), timestamps.size());
        });
    }

    @Override
    public Uni<Void> claimSlot(SlotClaim claim, RequestRecord record, RateLimitConfig config) {
        return locked(() -> {
            final var log = logOf(claim.resource());
            final var key = slotKey(claim);
            final var existing = log.slots.get(key);
            if (existing != null && !existing.isExpired(claim.claimedAt())) {
                throw new SlotClaimConflictException(claim.resource(), claim.scope(), claim.slotIndex());
            }
            log.slots.put(key, claim);
            log.records.add(record);
            return null;
        });
    }

    @Override
    public Uni<Void> deleteResource(String resource) {
        return locked(() -> {
            resources.remove(resource);
            return null;
        });
    }

    @Override
    public Uni<Void> deleteAll() {
        return locked(() -> {
            resources.clear();
            return null;
        });
    }

    @Override
    public Uni<Set<String>> findResources() {
        return locked(() -> {
            final Set<String> withRecords = new TreeSet<>();
            resources.forEach((resource, log) -> {
                if (!log.records.isEmpty()) {
                    withRecords.add(resource);
                }
            });
            return withRecords;
        });
    }

    @Override
    public Uni<Map<String, Long>> countByResource() {
        return locked(() -> {
            final Map<String, Long> counts = new HashMap<>();
            resources.forEach((resource, log) -> {
                if (!log.records.isEmpty()) {
                    counts.put(resource, (long) log.records.size());
                }
            });
            return counts;
        });
    }

    @Override
    public Uni<Long> deleteOlderThan(String resource, long cutoff) {
        return locked(() -> {
            final var log = resources.get(resource);
            if (log == null) {
                return 0L;
            }
            final var before = log.records.size();
            log.records.removeIf(record -> record.timestamp() < cutoff);
            final long deleted = before - log.records.size();
            if (log.isEmpty()) {
                resources.remove(resource);
            }
            return deleted;
        });
    }

    @Override
    public Uni<Long> deleteExpiredSlots(long now) {
        return locked(() -> {
            long deleted = 0;
            final var iterator = resources.values().iterator();
            while (iterator.hasNext()) {
                final var log = iterator.next();
                final var before = log.slots.size();
                log.slots.values().removeIf(claim -> claim.isExpired(now));
                deleted += before - log.slots.size();
                if (log.isEmpty()) {
                    iterator.remove();
                }
            }
            return deleted;
        });
    }

    /**
     * Number of held or expired slot claims of a resource (for testing).
     */
    public int slotCount(String resource) {
        lock.lock();
        try {
            final var log = resources.get(resource);
            return log == null ? 0 : log.slots.size();
        } finally {
            lock.unlock();
        }
    }

    private <T> Uni<T> locked(Supplier<T> action) {
        return Uni.createFrom().item(() -> {
            lock.lock();
            try {
                return action.get();
            } finally {
                lock.unlock();
            }
        });
    }

    private ResourceLog logOf(String resource) {
        return resources.computeIfAbsent(resource, ignored -> new ResourceLog());
    }

    private static boolean matches(RequestRecord record, Priority priority, long fromInclusive) {
        if (record.timestamp() < fromInclusive) {
            return false;
        }
        return priority == null || record.priority().filter(priority::equals).isPresent();
    }

    private static String slotKey(SlotClaim claim) {
        return claim.scope() + "#" + claim.slotIndex();
    }

    private static final class ResourceLog {
        private final List<RequestRecord> records = new ArrayList<>();
        private final Map<String, SlotClaim> slots = new HashMap<>();

        boolean isEmpty() {
            return records.isEmpty() && slots.isEmpty();
        }
    }
}
