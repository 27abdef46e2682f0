package com.bulk.ingest.resilience;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import javax.sql.DataSource;

import org.springframework.dao.DataAccessException;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;

/**
 * Guarded access to the pooled database connections used for sink and dedup writes.
 *
 * <p>Every call passes through the database circuit breaker. Only transient failures
 * (connection loss, timeouts, lock contention) count towards opening it; a constraint
 * violation proves the database is reachable and counts as a healthy response.
 */
@Slf4j
public class ResourcePoolManager implements MeterBinder {

    private static final int LATENCY_WINDOW = 256;
    private static final int PROBE_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final CircuitBreaker circuitBreaker;
    private final FailureClassifier classifier;

    private final AtomicLong queryCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final long[] latencyNanos = new long[LATENCY_WINDOW];
    private int latencyCursor;
    private int latencySamples;

    @FunctionalInterface
    public interface ConnectionCallback<T> {
        T doInConnection(Connection connection) throws SQLException;
    }

    public ResourcePoolManager(DataSource dataSource, CircuitBreaker circuitBreaker, FailureClassifier classifier) {
        this.dataSource = dataSource;
        this.circuitBreaker = circuitBreaker;
        this.classifier = classifier;
    }

    public <T> T withConnection(ConnectionCallback<T> callback) {
        return execute("withConnection", false, callback);
    }

    /**
     * Runs the callback in one transaction: commit on normal return, rollback on any exception.
     */
    public <T> T withTransaction(ConnectionCallback<T> callback) {
        return execute("withTransaction", true, callback);
    }

    /**
     * Health probe. Goes through the breaker, so a half-open circuit closes on a good probe.
     */
    public boolean probe() {
        try {
            return withConnection(connection -> connection.isValid(PROBE_TIMEOUT_SECONDS));
        } catch (CircuitOpenException e) {
            log.debug("Database probe short-circuited: {}", e.getMessage());
            return false;
        } catch (DataAccessException e) {
            log.warn("Database probe failed: {}", e.getMessage());
            return false;
        }
    }

    public FailureClassifier getClassifier() {
        return classifier;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public PoolMetrics metrics() {
        int active = 0;
        int idle = 0;
        int total = 0;
        if (dataSource instanceof HikariDataSource hikari && hikari.getHikariPoolMXBean() != null) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            active = pool.getActiveConnections();
            idle = pool.getIdleConnections();
            total = pool.getTotalConnections();
        }
        return new PoolMetrics(active, idle, total, queryCount.get(), errorCount.get(),
                averageLatencyMillis(), circuitBreaker.getState());
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("bulk.ingest.db.connections.active", this, m -> m.metrics().activeConnections())
                .register(registry);
        Gauge.builder("bulk.ingest.db.connections.idle", this, m -> m.metrics().idleConnections())
                .register(registry);
        Gauge.builder("bulk.ingest.db.latency.avg", this, ResourcePoolManager::averageLatencyMillis)
                .baseUnit("milliseconds")
                .register(registry);
        Gauge.builder("bulk.ingest.db.circuit.open", circuitBreaker,
                        cb -> cb.getState() == CircuitBreaker.State.CLOSED ? 0 : 1)
                .register(registry);
        FunctionCounter.builder("bulk.ingest.db.queries", queryCount, AtomicLong::get).register(registry);
        FunctionCounter.builder("bulk.ingest.db.errors", errorCount, AtomicLong::get).register(registry);
    }

    private <T> T execute(String task, boolean transactional, ConnectionCallback<T> callback) {
        circuitBreaker.acquirePermission();
        long start = System.nanoTime();
        T result;
        try (Connection connection = dataSource.getConnection()) {
            result = transactional ? inTransaction(connection, callback) : callback.doInConnection(connection);
        } catch (SQLException e) {
            DataAccessException translated = classifier.translate(task, e);
            recordFailure(start, translated);
            throw translated;
        } catch (RuntimeException e) {
            recordFailure(start, e);
            throw e;
        }
        recordLatency(start);
        circuitBreaker.onSuccess();
        return result;
    }

    private <T> T inTransaction(Connection connection, ConnectionCallback<T> callback) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        if (autoCommit) {
            connection.setAutoCommit(false);
        }
        try {
            T result = callback.doInConnection(connection);
            connection.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                log.warn("Rollback failed after {}", e.getMessage(), rollbackFailure);
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        } finally {
            if (autoCommit) {
                connection.setAutoCommit(true);
            }
        }
    }

    private void recordFailure(long start, RuntimeException failure) {
        recordLatency(start);
        errorCount.incrementAndGet();
        if (classifier.isTransient(failure)) {
            circuitBreaker.onFailure();
        } else {
            circuitBreaker.onSuccess();
        }
    }

    private synchronized void recordLatency(long start) {
        queryCount.incrementAndGet();
        latencyNanos[latencyCursor] = System.nanoTime() - start;
        latencyCursor = (latencyCursor + 1) % LATENCY_WINDOW;
        latencySamples = Math.min(latencySamples + 1, LATENCY_WINDOW);
    }

    private synchronized double averageLatencyMillis() {
        if (latencySamples == 0) {
            return 0.0;
        }
        long sum = 0;
        for (int i = 0; i < latencySamples; i++) {
            sum += latencyNanos[i];
        }
        return (double) sum / latencySamples / TimeUnit.MILLISECONDS.toNanos(1);
    }
}
