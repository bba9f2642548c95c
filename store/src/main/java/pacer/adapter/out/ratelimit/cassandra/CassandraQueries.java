package pacer.adapter.out.ratelimit.cassandra;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.BatchStatement;
import com.datastax.oss.driver.api.core.cql.BatchableStatement;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.DefaultBatchType;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.Statement;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import pacer.core.exception.StoreDestroyedException;

/**
 * Prepared statement cache and async execution shared by the Cassandra repositories.
 *
 * <p>Statements are prepared on first use, so a missing table is reported by the
 * operation that needs it. Every failure goes through {@link CassandraErrors}.
 */
final class CassandraQueries {

    private static final Logger LOG = Logger.getLogger(CassandraQueries.class);

    static final int PAGE_SIZE = 500;
    static final int MAX_PAGES = 10_000;

    private final CqlSession session;
    private final String table;
    private final boolean ownsSession;
    private final Executor executor;
    private final ConcurrentMap<String, CompletableFuture<PreparedStatement>> prepared = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    CassandraQueries(CqlSession session, String table, boolean ownsSession) {
        this(session, table, ownsSession, Infrastructure.getDefaultWorkerPool());
    }

    CassandraQueries(CqlSession session, String table, boolean ownsSession, Executor executor) {
        this.session = session;
        this.table = table;
        this.ownsSession = ownsSession;
        this.executor = executor;
    }

    String table() {
        return table;
    }

    boolean isClosed() {
        return closed.get();
    }

    Uni<BoundStatement> bind(String cql, Object... values) {
        return prepare(cql).map(statement -> statement.bind(values));
    }

    Uni<AsyncResultSet> execute(String cql, Object... values) {
        return bind(cql, values).flatMap(this::execute);
    }

    Uni<AsyncResultSet> execute(Statement<?> statement) {
        if (closed.get()) {
            return Uni.createFrom().failure(new StoreDestroyedException());
        }
        return Uni.createFrom()
                .completionStage(() -> session.executeAsync(statement).toCompletableFuture())
                .emitOn(executor)
                .onFailure()
                .transform(this::translate);
    }

    /**
     * Execute bound statements as one logged batch.
     */
    Uni<AsyncResultSet> executeBatch(List<BoundStatement> statements) {
        final List<BatchableStatement<?>> batchable = new ArrayList<>(statements);
        final var batch = BatchStatement.builder(DefaultBatchType.LOGGED)
                .addStatements(batchable)
                .build();
        return execute(batch);
    }

    /**
     * Read every page of a query, stopping if the result never ends.
     */
    <T> Uni<List<T>> fetchAll(String cql, Function<Row, T> mapper, Object... values) {
        return bind(cql, values)
                .map(statement -> statement.setPageSize(PAGE_SIZE))
                .flatMap(this::execute)
                .flatMap(first -> drain(first, mapper, new ArrayList<>(), 1, null));
    }

    Throwable translate(Throwable failure) {
        return CassandraErrors.translate(failure, table);
    }

    void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        prepared.clear();
        if (ownsSession && !session.isClosed()) {
            session.close();
            LOG.info("Closed Cassandra rate limit session");
        }
    }

    private Uni<PreparedStatement> prepare(String cql) {
        if (closed.get()) {
            return Uni.createFrom().failure(new StoreDestroyedException());
        }
        return Uni.createFrom()
                .completionStage(() -> {
                    final var future = prepared.computeIfAbsent(
                            cql, key -> session.prepareAsync(key).toCompletableFuture());
                    future.whenComplete((statement, error) -> {
                        if (error != null) {
                            prepared.remove(cql, future);
                        }
                    });
                    return future;
                })
                .onFailure()
                .transform(this::translate);
    }

    private <T> Uni<List<T>> drain(
            AsyncResultSet page, Function<Row, T> mapper, List<T> results, int pagesRead, ByteBuffer lastState) {
        for (Row row : page.currentPage()) {
            results.add(mapper.apply(row));
        }
        if (!page.hasMorePages()) {
            return Uni.createFrom().item(results);
        }

        final var state = page.getExecutionInfo().getPagingState();
        if (pagesRead >= MAX_PAGES || (state != null && state.equals(lastState))) {
            LOG.warnf("Stopped paging %s after %d pages; the result did not end", table, pagesRead);
            return Uni.createFrom().item(results);
        }

        return Uni.createFrom()
                .completionStage(() -> page.fetchNextPage().toCompletableFuture())
                .emitOn(executor)
                .onFailure()
                .transform(this::translate)
                .flatMap(next -> drain(next, mapper, results, pagesRead + 1, state));
    }
}
