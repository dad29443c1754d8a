package io.eventcore.jdbc.tx;

import io.eventcore.EventCoreException;
import io.eventcore.StoreUnavailableException;
import io.eventcore.jdbc.JdbcTemplate;
import io.eventcore.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transaction manager for plain JDBC. Obtains a connection, disables auto-commit and binds
 * it to a {@link ThreadLocalTxContext}, so that event store appends on the same thread join
 * the transaction and publish only after it commits.
 *
 * <pre>{@code
 * try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
 *   orders.save(order);
 *   tx.commit();
 * }
 *
 * long version = txManager.inTransaction(() -> eventStore.append(event, 0));
 * }</pre>
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  /**
   * Work executed inside {@link #inTransaction(TransactionalWork)}.
   */
  @FunctionalInterface
  public interface TransactionalWork<T> {
    T run() throws Exception;
  }

  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  public ThreadLocalTxContext txContext() {
    return txContext;
  }

  /**
   * Begins a transaction on this thread.
   *
   * @return the transaction handle; close it with try-with-resources
   * @throws SQLException if a connection cannot be obtained or configured
   * @throws IllegalStateException if a transaction is already active on this thread
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      connection.close();
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  /**
   * Runs {@code work} in a new transaction, committing if it returns normally and rolling
   * back if it throws.
   *
   * @return the work's result
   * @throws StoreUnavailableException if the connection cannot be obtained
   * @throws RuntimeException the work's own unchecked failure, unchanged
   */
  public <T> T inTransaction(TransactionalWork<T> work) {
    Objects.requireNonNull(work, "work");
    Transaction tx;
    try {
      tx = begin();
    } catch (SQLException e) {
      throw new StoreUnavailableException("Failed to begin transaction", e);
    }
    try (tx) {
      T result = work.run();
      tx.commit();
      return result;
    } catch (SQLException e) {
      throw JdbcTemplate.translate("Transaction failed", e);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new EventCoreException("Transactional work failed", e);
    }
  }

  /**
   * An active transaction. If neither {@link #commit()} nor {@link #rollback()} was called,
   * {@link #close()} rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
    }

    /**
     * Commits, then runs the after-commit callbacks. If the commit fails the transaction is
     * rolled back and the after-rollback callbacks run instead.
     */
    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        rollbackAfterFailedCommit(e);
        finish(false);
        throw e;
      }
      finish(true);
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finish(false);
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finish(boolean committed) throws SQLException {
      completed = true;
      try {
        if (committed) {
          txContext.completeCommitted();
        } else {
          txContext.completeRolledBack();
        }
      } finally {
        try {
          connection.setAutoCommit(true);
        } catch (SQLException e) {
          logger.log(Level.FINE, "Failed to restore auto-commit", e);
        } finally {
          connection.close();
        }
      }
    }

    private void rollbackAfterFailedCommit(SQLException commitFailure) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        commitFailure.addSuppressed(e);
      }
    }
  }
}
