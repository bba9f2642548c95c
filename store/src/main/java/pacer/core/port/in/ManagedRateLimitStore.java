package pacer.core.port.in;

/**
 * A rate limit store that also exposes its introspection and maintenance operations.
 *
 * <p>Every store built by the core services implements this.
 */
public interface ManagedRateLimitStore extends RateLimitStore, RateLimitMonitoring {}
