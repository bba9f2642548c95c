package pacer.core.port.out;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import pacer.core.exception.SlotClaimConflictException;
import pacer.core.model.ratelimit.Priority;
import pacer.core.model.ratelimit.RateLimitConfig;
import pacer.core.model.ratelimit.RequestRecord;
import pacer.core.model.ratelimit.SlotClaim;

/**
 * Port for persisting request records and admission slot claims.
 *
 * <p>Wherever a {@code priority} parameter is null the operation covers records
 * of every priority, including records stored without one.
 *
 * <p>Implementations translate a missing backing table into
 * {@link pacer.core.exception.TableNotFoundException} on every operation.
 */
public interface RateLimitRepository {

    /**
     * Optional features of this backend. Read once when a store is built.
     */
    Set<StoreCapability> capabilities();

    /**
     * Store a request record.
     *
     * @param record the record
     * @param config the resource config, used for storage-native expiry
     * @return completion
     */
    Uni<Void> insert(RequestRecord record, RateLimitConfig config);

    /**
     * Count records with {@code timestamp >= fromInclusive}.
     */
    Uni<Long> countSince(String resource, Priority priority, long fromInclusive);

    /**
     * Timestamp of the oldest record with {@code timestamp >= fromInclusive}.
     */
    Uni<Optional<Long>> findOldestSince(String resource, Priority priority, long fromInclusive);

    /**
     * The newest {@code maxResults} timestamps at or after {@code fromInclusive}, oldest first.
     */
    Uni<List<Long>> findRecentTimestamps(String resource, Priority priority, long fromInclusive, int maxResults);

    /**
     * Claim a slot and store the request record.
     *
     * <p>Succeeds only if the slot is unclaimed or its previous claim has expired at
     * {@link SlotClaim#claimedAt()}. A slot held by someone else fails with an error
     * for which {@link #isConditionalConflict(Throwable)} returns true; the record is
     * then not stored.
     *
     * @param claim the slot claim
     * @param record the record to store with it
     * @param config the resource config, used for storage-native expiry
     * @return completion
     */
    Uni<Void> claimSlot(SlotClaim claim, RequestRecord record, RateLimitConfig config);

    /**
     * Delete all records and slot claims of a resource.
     */
    Uni<Void> deleteResource(String resource);

    /**
     * Delete all records and slot claims.
     */
    Uni<Void> deleteAll();

    /**
     * Resources with at least one stored record.
     */
    Uni<Set<String>> findResources();

    /**
     * Stored record count per resource, regardless of age.
     *
     * <p>Requires {@link StoreCapability#STATISTICS}.
     */
    Uni<Map<String, Long>> countByResource();

    /**
     * Delete records of a resource with {@code timestamp < cutoff}.
     *
     * <p>Requires {@link StoreCapability#EXPLICIT_CLEANUP}.
     *
     * @return number of deleted records
     */
    Uni<Long> deleteOlderThan(String resource, long cutoff);

    /**
     * Delete slot claims that expired at or before {@code now}.
     *
     * <p>Requires {@link StoreCapability#EXPLICIT_CLEANUP}.
     *
     * @return number of deleted claims
     */
    Uni<Long> deleteExpiredSlots(long now);

    /**
     * Whether a failure of {@link #claimSlot} means the slot is held by someone else.
     */
    default boolean isConditionalConflict(Throwable failure) {
        return failure instanceof SlotClaimConflictException;
    }

    /**
     * Release resources held by this repository.
     */
    default void close() {}
}
