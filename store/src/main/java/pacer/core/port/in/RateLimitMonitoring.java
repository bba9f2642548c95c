package pacer.core.port.in;

import java.util.List;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import pacer.core.model.ratelimit.RateLimitStats;
import pacer.core.model.ratelimit.ResourceUsage;
import pacer.core.port.out.StoreCapability;

/**
 * Introspection and maintenance of a rate limit store.
 */
public interface RateLimitMonitoring {

    /**
     * Capabilities of the backing storage.
     */
    Set<StoreCapability> capabilities();

    /**
     * Store-wide counters.
     *
     * @throws UnsupportedOperationException (as a failure) if the backend does not support statistics
     */
    Uni<RateLimitStats> getStats();

    /**
     * Window usage of every resource with stored records.
     *
     * @throws UnsupportedOperationException (as a failure) if the backend does not support statistics
     */
    Uni<List<ResourceUsage>> listResources();

    /**
     * Delete records that fell out of their window, expired slot claims and expired cooldowns.
     *
     * <p>No-op for backends relying on native expiry.
     *
     * @return number of records deleted
     */
    Uni<Long> cleanup();
}
