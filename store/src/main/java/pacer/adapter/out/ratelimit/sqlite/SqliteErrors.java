package pacer.adapter.out.ratelimit.sqlite;

import java.sql.SQLException;
import java.util.regex.Pattern;

import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import pacer.core.exception.RateLimitStoreException;
import pacer.core.exception.TableNotFoundException;

/**
 * Translation of SQLite errors into the store's error vocabulary.
 */
final class SqliteErrors {

    private static final Pattern MISSING_TABLE = Pattern.compile("no such table: (?:main\\.)?(\\w+)");
    private static final String SETUP_HINT = "run the rate limit schema DDL or enable pacer.rate-limit.sqlite.create-schema";

    private SqliteErrors() {}

    static RuntimeException translate(SQLException e) {
        final var message = e.getMessage() == null ? "" : e.getMessage();
        final var missing = MISSING_TABLE.matcher(message);
        if (missing.find()) {
            return new TableNotFoundException(missing.group(1), SETUP_HINT, e);
        }
        return new RateLimitStoreException("SQLite operation failed: " + message, e);
    }

    /**
     * Whether a uniqueness or primary key constraint failed anywhere in the cause chain.
     */
    static boolean isConstraintViolation(Throwable failure) {
        for (var cause = failure; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLiteException sqlite
                    && (sqlite.getResultCode().code & 0xFF) == SQLiteErrorCode.SQLITE_CONSTRAINT.code) {
                return true;
            }
            if (cause instanceof SQLException sql
                    && !(cause instanceof SQLiteException)
                    && (sql.getErrorCode() & 0xFF) == SQLiteErrorCode.SQLITE_CONSTRAINT.code) {
                return true;
            }
        }
        return false;
    }
}
