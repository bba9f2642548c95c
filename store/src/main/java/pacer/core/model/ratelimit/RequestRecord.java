package pacer.core.model.ratelimit;

import java.util.Optional;
import java.util.UUID;

/**
 * One accepted request.
 *
 * <p>The unique id keeps records distinct when several requests share a millisecond.
 *
 * @param resource the resource key
 * @param timestamp epoch milliseconds at which the request was recorded
 * @param priority the traffic class, empty for the non-adaptive store
 * @param uniqueId a random identifier
 */
public record RequestRecord(String resource, long timestamp, Optional<Priority> priority, String uniqueId) {

    public RequestRecord {
        if (resource == null) {
            throw new IllegalArgumentException("resource must not be null");
        }
        if (priority == null) {
            priority = Optional.empty();
        }
        if (uniqueId == null || uniqueId.isEmpty()) {
            throw new IllegalArgumentException("uniqueId must not be empty");
        }
    }

    /**
     * Create a record with a fresh random id.
     *
     * @param resource the resource key
     * @param timestamp epoch milliseconds
     * @param priority the traffic class, or null when not tracked
     * @return the record
     */
    public static RequestRecord create(String resource, long timestamp, Priority priority) {
        return new RequestRecord(
                resource, timestamp, Optional.ofNullable(priority), UUID.randomUUID().toString());
    }
}
