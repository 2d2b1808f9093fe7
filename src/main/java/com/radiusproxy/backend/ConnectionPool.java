package com.radiusproxy.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Small bounded JDBC connection pool. Connections are handed out per call,
 * checked for liveness before reuse and recycled once older than the
 * configured lifetime.
 */
public class ConnectionPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);

    @FunctionalInterface
    public interface ConnectionFactory {
        Connection open() throws SQLException;
    }

    private final String poolName;
    private final ConnectionFactory factory;
    private final long maxLifetimeMillis;
    private final long borrowTimeoutMillis;
    private final int validationTimeoutSeconds;
    private final Clock clock;
    private final Semaphore permits;
    private final Deque<PooledConnection> idle = new ArrayDeque<>();

    private boolean closed;

    public ConnectionPool(String poolName, ConnectionFactory factory, int maxSize,
                          long maxLifetimeMillis, long borrowTimeoutMillis) {
        this(poolName, factory, maxSize, maxLifetimeMillis, borrowTimeoutMillis, Clock.systemUTC());
    }

    ConnectionPool(String poolName, ConnectionFactory factory, int maxSize,
                   long maxLifetimeMillis, long borrowTimeoutMillis, Clock clock) {
        if (factory == null) {
            throw new IllegalArgumentException("ConnectionFactory cannot be null");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Pool size must be positive");
        }
        if (maxLifetimeMillis <= 0 || borrowTimeoutMillis <= 0) {
            throw new IllegalArgumentException("Pool timeouts must be positive");
        }

        this.poolName = poolName;
        this.factory = factory;
        this.maxLifetimeMillis = maxLifetimeMillis;
        this.borrowTimeoutMillis = borrowTimeoutMillis;
        this.validationTimeoutSeconds = (int) Math.max(1, TimeUnit.MILLISECONDS.toSeconds(borrowTimeoutMillis));
        this.clock = clock;
        this.permits = new Semaphore(maxSize, true);
    }

    /**
     * Borrows a live connection, waiting at most the borrow timeout for a
     * free slot.
     *
     * @return a lease that must be closed to hand the connection back
     * @throws SQLException if no slot frees up in time or a connection cannot be opened
     */
    public Lease borrow() throws SQLException {
        try {
            if (!permits.tryAcquire(borrowTimeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new SQLTimeoutException("Timed out waiting for a connection from pool " + poolName);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLException("Interrupted while waiting for a connection from pool " + poolName, e);
        }

        try {
            while (true) {
                PooledConnection pooled = pollIdle();
                if (pooled == null) {
                    return new Lease(new PooledConnection(factory.open(), clock.millis()));
                }
                if (isExpired(pooled)) {
                    logger.debug("Pool {}: recycling connection older than {} ms", poolName, maxLifetimeMillis);
                    discard(pooled);
                    continue;
                }
                if (!isAlive(pooled)) {
                    logger.debug("Pool {}: discarding dead connection", poolName);
                    discard(pooled);
                    continue;
                }
                return new Lease(pooled);
            }
        } catch (SQLException | RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    /**
     * Closes idle connections. Connections currently leased are closed when
     * they are handed back.
     */
    @Override
    public void close() {
        List<PooledConnection> drained;
        synchronized (this) {
            closed = true;
            drained = new ArrayList<>(idle);
            idle.clear();
        }
        for (PooledConnection pooled : drained) {
            discard(pooled);
        }
        logger.debug("Pool {} closed", poolName);
    }

    public synchronized int getIdleCount() {
        return idle.size();
    }

    public int getAvailablePermits() {
        return permits.availablePermits();
    }

    private synchronized PooledConnection pollIdle() {
        return idle.pollFirst();
    }

    private void release(PooledConnection pooled, boolean broken) {
        try {
            boolean parked = false;
            if (!broken && !isExpired(pooled)) {
                synchronized (this) {
                    if (!closed) {
                        idle.addFirst(pooled);
                        parked = true;
                    }
                }
            }
            if (!parked) {
                discard(pooled);
            }
        } finally {
            permits.release();
        }
    }

    private boolean isExpired(PooledConnection pooled) {
        return clock.millis() - pooled.openedAt >= maxLifetimeMillis;
    }

    private boolean isAlive(PooledConnection pooled) {
        try {
            return !pooled.connection.isClosed() && pooled.connection.isValid(validationTimeoutSeconds);
        } catch (SQLException e) {
            return false;
        }
    }

    private void discard(PooledConnection pooled) {
        try {
            pooled.connection.close();
        } catch (SQLException e) {
            logger.debug("Pool {}: error closing connection: {}", poolName, e.getMessage());
        }
    }

    private static final class PooledConnection {
        final Connection connection;
        final long openedAt;

        PooledConnection(Connection connection, long openedAt) {
            this.connection = connection;
            this.openedAt = openedAt;
        }
    }

    /**
     * A borrowed connection. Closing the lease returns the connection to the
     * pool unless it was marked broken.
     */
    public final class Lease implements AutoCloseable {
        private final PooledConnection pooled;
        private boolean broken;
        private boolean released;

        private Lease(PooledConnection pooled) {
            this.pooled = pooled;
        }

        public Connection getConnection() {
            return pooled.connection;
        }

        public void markBroken() {
            broken = true;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                release(pooled, broken);
            }
        }
    }
}
