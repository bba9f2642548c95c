package pacer.core.model.ratelimit;

import pacer.core.exception.InvalidResourceKeyException;

/**
 * Validation of caller-supplied keys and their persisted key layout.
 *
 * <p>Layout shared by the partitioned backends:
 * <ul>
 *   <li>request records: {@code RATELIMIT#{resource}} / {@code TS#{timestampMs}#{uniqueId}}</li>
 *   <li>priority index: {@code RATELIMIT#{resource}#{priority}}</li>
 *   <li>slot claims: {@code RATELIMIT_SLOT#{resource}} / {@code SLOT#{index}} or
 *       {@code SLOT#{priority}#{index}}</li>
 *   <li>cooldowns: {@code COOLDOWN#{origin}} for both partition and sort key</li>
 * </ul>
 */
public final class ResourceKeyCodec {

    public static final int MAX_KEY_LENGTH = 512;

    public static final String RATE_LIMIT_PREFIX = "RATELIMIT#";
    public static final String SLOT_PREFIX = "RATELIMIT_SLOT#";
    public static final String COOLDOWN_PREFIX = "COOLDOWN#";
    public static final String RECORD_SORT_PREFIX = "TS#";
    /** Sorts after every record sort key. */
    public static final String RECORD_SORT_UPPER_BOUND = "TS$";

    private static final int EPOCH_MILLIS_DIGITS = 13;

    private ResourceKeyCodec() {}

    /**
     * Validate a resource key.
     *
     * @throws InvalidResourceKeyException if empty, too long or containing control characters
     */
    public static String validateResource(String resource) {
        return validate("resource", resource);
    }

    /**
     * Validate a cooldown origin key.
     *
     * @throws InvalidResourceKeyException if empty, too long or containing control characters
     */
    public static String validateOrigin(String origin) {
        return validate("origin", origin);
    }

    static String validate(String label, String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidResourceKeyException(label + " must not be empty");
        }
        if (value.length() > MAX_KEY_LENGTH) {
            throw new InvalidResourceKeyException(
                    label + " exceeds maximum length of " + MAX_KEY_LENGTH + " characters");
        }
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                throw new InvalidResourceKeyException(label + " must not contain control characters");
            }
        }
        return value;
    }

    public static String partitionKey(String resource) {
        return RATE_LIMIT_PREFIX + resource;
    }

    public static String priorityIndexKey(String resource, Priority priority) {
        return RATE_LIMIT_PREFIX + resource + "#" + priority.value();
    }

    public static String slotPartitionKey(String resource) {
        return SLOT_PREFIX + resource;
    }

    public static String recordSortKey(long timestamp, String uniqueId) {
        return RECORD_SORT_PREFIX + timestamp + "#" + uniqueId;
    }

    public static String slotSortKey(String scope, int slotIndex) {
        if (SlotClaim.DEFAULT_SCOPE.equals(scope)) {
            return "SLOT#" + slotIndex;
        }
        return "SLOT#" + scope + "#" + slotIndex;
    }

    public static String cooldownKey(String origin) {
        return COOLDOWN_PREFIX + origin;
    }

    /**
     * Lowest record sort key at or after {@code fromInclusive}.
     *
     * <p>Sort keys compare as text, so bounds with fewer digits than a current epoch
     * timestamp fall back to the start of the record range.
     */
    public static String recordSortLowerBound(long fromInclusive) {
        if (fromInclusive <= 0 || String.valueOf(fromInclusive).length() < EPOCH_MILLIS_DIGITS) {
            return RECORD_SORT_PREFIX;
        }
        return RECORD_SORT_PREFIX + fromInclusive;
    }
}
