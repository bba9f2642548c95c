package pacer.core.service.ratelimit;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import pacer.core.model.ratelimit.Priority;
import pacer.core.model.ratelimit.RateLimitConfig;
import pacer.core.model.ratelimit.RequestRecord;
import pacer.core.model.ratelimit.SlotClaim;
import pacer.core.port.out.RateLimitRepository;

/**
 * Reserves capacity by claiming one of {@code limit} numbered slots.
 *
 * <p>Each slot can be held by one caller per window, so no more than {@code limit}
 * acquisitions succeed inside any window, whatever the number of concurrent callers
 * or processes. Slots are tried in index order; a conflict on one slot moves on to
 * the next and every other failure ends the attempt immediately.
 */
public final class AtomicSlotAcquirer {

    private static final Logger LOG = Logger.getLogger(AtomicSlotAcquirer.class);

    private final RateLimitRepository repository;
    private final SlidingWindowCounter counter;

    public AtomicSlotAcquirer(RateLimitRepository repository, SlidingWindowCounter counter) {
        this.repository = repository;
        this.counter = counter;
    }

    /**
     * Try to claim a slot and record the request with it.
     *
     * @param resource the resource key
     * @param priority the priority scope, or null for the non-adaptive store
     * @param slotLimit the number of slots available to this scope
     * @param config the resource config
     * @param now epoch milliseconds
     * @return true if a slot was claimed, false if capacity is exhausted
     */
    public Uni<Boolean> acquire(String resource, Priority priority, int slotLimit, RateLimitConfig config, long now) {
        if (slotLimit <= 0) {
            return Uni.createFrom().item(false);
        }

        return counter.count(resource, priority, config, now).flatMap(count -> {
            if (slotLimit - count <= 0) {
                LOG.debugf("Window of %s is full (%d/%d), not claiming a slot", resource, count, slotLimit);
                return Uni.createFrom().item(false);
            }

            final var record = RequestRecord.create(resource, now, priority);
            final var scope = SlotClaim.scopeFor(priority);
            final var expiresAt = now + config.windowMs();

            return Multi.createFrom()
                    .range(0, slotLimit)
                    .onItem()
                    .transformToUniAndConcatenate(
                            index -> claim(new SlotClaim(resource, scope, index, now, expiresAt), record, config))
                    .select()
                    .where(Boolean::booleanValue)
                    .toUni()
                    .onItem()
                    .ifNull()
                    .continueWith(() -> {
                        LOG.debugf("All %d slots of %s/%s are held", slotLimit, resource, scope);
                        return false;
                    });
        });
    }

    private Uni<Boolean> claim(SlotClaim claim, RequestRecord record, RateLimitConfig config) {
        return repository
                .claimSlot(claim, record, config)
                .replaceWith(true)
                .onFailure(repository::isConditionalConflict)
                .recoverWithItem(failure -> {
                    LOG.debugf("Slot %d of %s/%s is taken", claim.slotIndex(), claim.resource(), claim.scope());
                    return false;
                });
    }
}
