package pacer.core.port.out;

/**
 * Optional features a storage backend may support.
 */
public enum StoreCapability {
    /** Per-resource request counts can be listed. */
    STATISTICS,
    /** Expired data must be deleted explicitly; there is no native expiry. */
    EXPLICIT_CLEANUP
}
