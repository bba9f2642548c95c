package pacer.adapter.out.ratelimit.cassandra;

import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;

import com.datastax.oss.driver.api.core.servererrors.CASWriteUnknownException;
import com.datastax.oss.driver.api.core.servererrors.DefaultWriteType;
import com.datastax.oss.driver.api.core.servererrors.InvalidQueryException;
import com.datastax.oss.driver.api.core.servererrors.WriteTimeoutException;

import pacer.core.exception.SlotClaimConflictException;
import pacer.core.exception.TableNotFoundException;

/**
 * Translation of Cassandra driver errors into the store's error vocabulary.
 */
final class CassandraErrors {

    private static final Pattern UNCONFIGURED_TABLE = Pattern.compile("unconfigured table (\\w+)");
    private static final Pattern TABLE_DOES_NOT_EXIST = Pattern.compile("table (?:\\w+\\.)?(\\w+) does not exist");
    private static final String SETUP_HINT = "CQL migrations, Terraform, etc.; "
            + "or set pacer.rate-limit.cassandra.run-migrations=true";

    private CassandraErrors() {}

    /**
     * Replace a missing-table error with {@link TableNotFoundException}; anything else passes unchanged.
     */
    static Throwable translate(Throwable failure, String defaultTable) {
        final var cause = unwrap(failure);
        if (cause instanceof InvalidQueryException invalid) {
            final var message = invalid.getMessage() == null ? "" : invalid.getMessage();
            final var unconfigured = UNCONFIGURED_TABLE.matcher(message);
            if (unconfigured.find()) {
                return new TableNotFoundException(unconfigured.group(1), SETUP_HINT, invalid);
            }
            final var missing = TABLE_DOES_NOT_EXIST.matcher(message.toLowerCase(Locale.ROOT));
            if (missing.find()) {
                return new TableNotFoundException(missing.group(1), SETUP_HINT, invalid);
            }
            if (message.contains("Keyspace") && message.contains("does not exist")) {
                return new TableNotFoundException(defaultTable, SETUP_HINT, invalid);
            }
        }
        return cause;
    }

    /**
     * Whether a slot claim failed because another caller holds the slot.
     *
     * <p>A timed out lightweight transaction may or may not have applied; it is
     * treated as lost, which can only leave a slot unused.
     */
    static boolean isConditionalConflict(Throwable failure) {
        final var cause = unwrap(failure);
        if (cause instanceof SlotClaimConflictException || cause instanceof CASWriteUnknownException) {
            return true;
        }
        return cause instanceof WriteTimeoutException timeout && timeout.getWriteType() == DefaultWriteType.CAS;
    }

    private static Throwable unwrap(Throwable failure) {
        var cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
