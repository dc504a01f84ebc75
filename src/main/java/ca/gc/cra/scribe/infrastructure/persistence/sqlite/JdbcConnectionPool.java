package ca.gc.cra.scribe.infrastructure.persistence.sqlite;

import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.validation.Numbers;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bounded pool of reusable JDBC connections.
 * <p><strong>Why:</strong> Opening an embedded database connection per log row is expensive; unbounded reuse would
 * let bursts hold an arbitrary number of file handles.</p>
 * <p><strong>Role:</strong> Infrastructure resource manager used by the SQLite destinations.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Admit at most {@code maxPoolSize} concurrent holders through a counting semaphore.</li>
 *   <li>Hand out a resting connection after validating it, discarding unusable ones, or open a new one.</li>
 *   <li>Return usable connections to the resting queue and close the rest; always release the permit.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Lock-free queue plus atomic live counter; safe for any number of threads.</p>
 * <p><strong>Performance:</strong> Acquire is O(1) when a resting connection is valid.</p>
 * <p><strong>Observability:</strong> Increments {@code scribe.pool.connection.opened} and
 * {@code scribe.pool.connection.discarded}.</p>
 *
 * @implNote Live connections never exceed {@code maxPoolSize}: a connection is opened only while its caller holds
 * a permit, and one returned while the live count is above the maximum is closed instead of kept.
 * @since 0.1.0
 */
public final class JdbcConnectionPool implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(JdbcConnectionPool.class);

  static final String OPENED = "scribe.pool.connection.opened";
  static final String DISCARDED = "scribe.pool.connection.discarded";
  private static final int VALIDATION_TIMEOUT_SECONDS = 1;

  private final ConnectionOpener opener;
  private final int maxPoolSize;
  private final MetricsPort metrics;
  private final Semaphore permits;
  private final Queue<Connection> resting = new ConcurrentLinkedQueue<>();
  private final AtomicInteger live = new AtomicInteger();
  private final AtomicBoolean closed = new AtomicBoolean();

  /** Opens a new physical connection. */
  @FunctionalInterface
  public interface ConnectionOpener {
    Connection open() throws SQLException;
  }

  /**
   * Creates a pool.
   *
   * @param opener factory for new connections
   * @param maxPoolSize maximum live connections; must be positive
   * @param metrics metrics sink; {@code null} means {@link MetricsPort#NO_OP}
   */
  public JdbcConnectionPool(ConnectionOpener opener, int maxPoolSize, MetricsPort metrics) {
    this.opener = Objects.requireNonNull(opener, "opener");
    this.maxPoolSize = Numbers.requirePositive("maxPoolSize", maxPoolSize);
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.permits = new Semaphore(maxPoolSize, true);
  }

  /**
   * Checks out a connection, blocking until a slot is available.
   *
   * @return pooled handle; closing it returns the connection
   * @throws SQLException if the pool is closed, the wait is interrupted, or a new connection cannot be opened
   */
  public PooledConnection acquire() throws SQLException {
    ensureOpen();
    try {
      permits.acquire();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new SQLException("Interrupted while waiting for a pooled connection", ex);
    }
    return checkout();
  }

  /**
   * Checks out a connection, waiting at most {@code timeout} for a slot.
   *
   * @param timeout maximum wait
   * @return pooled handle
   * @throws SQLTimeoutException if no slot frees up in time
   * @throws SQLException if the pool is closed, the wait is interrupted, or opening fails
   */
  public PooledConnection acquire(Duration timeout) throws SQLException {
    ensureOpen();
    boolean acquired;
    try {
      acquired = permits.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new SQLException("Interrupted while waiting for a pooled connection", ex);
    }
    if (!acquired) {
      throw new SQLTimeoutException("No pooled connection available within " + timeout);
    }
    return checkout();
  }

  private PooledConnection checkout() throws SQLException {
    try {
      Connection connection;
      while ((connection = resting.poll()) != null) {
        if (isUsable(connection)) {
          return new PooledConnection(this, connection);
        }
        discard(connection);
      }
      connection = opener.open();
      live.incrementAndGet();
      metrics.increment(OPENED);
      return new PooledConnection(this, connection);
    } catch (SQLException | RuntimeException ex) {
      permits.release();
      throw ex;
    }
  }

  void release(Connection connection) {
    try {
      if (!closed.get() && live.get() <= maxPoolSize && isUsable(connection)) {
        resting.offer(connection);
        if (closed.get() && resting.remove(connection)) {
          discard(connection);
        }
      } else {
        discard(connection);
      }
    } finally {
      permits.release();
    }
  }

  /** Closes resting connections; connections still checked out are closed when returned. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    Connection connection;
    while ((connection = resting.poll()) != null) {
      discard(connection);
    }
  }

  public int maxPoolSize() {
    return maxPoolSize;
  }

  /** Live connections: checked out plus resting. */
  public int liveCount() {
    return live.get();
  }

  public int restingCount() {
    return resting.size();
  }

  public int availablePermits() {
    return permits.availablePermits();
  }

  private void ensureOpen() throws SQLException {
    if (closed.get()) {
      throw new SQLException("Connection pool is closed");
    }
  }

  private boolean isUsable(Connection connection) {
    try {
      return !connection.isClosed() && connection.isValid(VALIDATION_TIMEOUT_SECONDS);
    } catch (SQLException ex) {
      log.debug("Pooled connection failed validation", ex);
      return false;
    }
  }

  private void discard(Connection connection) {
    live.decrementAndGet();
    metrics.increment(DISCARDED);
    try {
      connection.close();
    } catch (SQLException ex) {
      log.debug("Failed to close discarded connection", ex);
    }
  }

  /**
   * Checked-out connection; closing it returns the connection to its pool exactly once.
   */
  public static final class PooledConnection implements AutoCloseable {
    private final JdbcConnectionPool owner;
    private Connection connection;

    private PooledConnection(JdbcConnectionPool owner, Connection connection) {
      this.owner = owner;
      this.connection = connection;
    }

    /**
     * Exposes the borrowed connection; callers must not close or retain it.
     *
     * @return active connection
     */
    public Connection connection() {
      if (connection == null) {
        throw new IllegalStateException("connection already returned");
      }
      return connection;
    }

    @Override
    public void close() {
      Connection returning = connection;
      if (returning == null) {
        return;
      }
      connection = null;
      owner.release(returning);
    }
  }
}
