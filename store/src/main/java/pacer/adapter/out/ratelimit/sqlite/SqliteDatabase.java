package pacer.adapter.out.ratelimit.sqlite;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;

import pacer.core.exception.StoreDestroyedException;
import pacer.spi.StorageProviderException;

/**
 * A single SQLite connection shared by the SQLite repositories.
 *
 * <p>Statements run one at a time under a lock, off the caller's thread on the
 * Mutiny worker pool. JDBC failures are translated by {@link SqliteErrors}.
 */
public final class SqliteDatabase implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SqliteDatabase.class);

    private final Connection connection;
    private final boolean ownsConnection;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Executor executor;

    private SqliteDatabase(Connection connection, boolean ownsConnection, Executor executor) {
        this.connection = connection;
        this.ownsConnection = ownsConnection;
        this.executor = executor;
    }

    /**
     * Open (and create if missing) a database file.
     *
     * @param path file path, or {@code :memory:}
     * @param busyTimeout how long a statement waits for a lock held by another process
     * @return the database
     * @throws StorageProviderException if the file cannot be opened
     */
    public static SqliteDatabase open(String path, Duration busyTimeout) {
        final var config = new SQLiteConfig();
        config.setBusyTimeout((int) busyTimeout.toMillis());
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        try {
            final var connection = DriverManager.getConnection("jdbc:sqlite:" + path, config.toProperties());
            LOG.infof("Opened SQLite rate limit database %s", path);
            return new SqliteDatabase(connection, true, Infrastructure.getDefaultWorkerPool());
        } catch (SQLException e) {
            throw new StorageProviderException("Failed to open SQLite database " + path, e);
        }
    }

    /**
     * Use a connection owned by the caller. It is never closed by this class.
     */
    public static SqliteDatabase wrap(Connection connection) {
        return new SqliteDatabase(connection, false, Infrastructure.getDefaultWorkerPool());
    }

    /**
     * Run statements in auto-commit mode.
     */
    public <T> Uni<T> query(SqlWork<T> work) {
        return Uni.createFrom().item(() -> execute(work)).runSubscriptionOn(executor);
    }

    /**
     * Run statements in one transaction, rolled back on any failure.
     */
    public <T> Uni<T> transaction(SqlWork<T> work) {
        return query(connection -> {
            connection.setAutoCommit(false);
            try {
                final var result = work.apply(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        });
    }

    /**
     * Run statements synchronously on the calling thread.
     */
    public <T> T execute(SqlWork<T> work) {
        lock.lock();
        try {
            if (closed.get()) {
                throw new StoreDestroyedException();
            }
            return work.apply(connection);
        } catch (SQLException e) {
            throw SqliteErrors.translate(e);
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true) || !ownsConnection) {
            return;
        }
        lock.lock();
        try {
            connection.close();
            LOG.info("Closed SQLite rate limit database");
        } catch (SQLException e) {
            LOG.warnv(e, "Failed to close SQLite connection");
        } finally {
            lock.unlock();
        }
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    /**
     * Work against the shared connection.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }
}
