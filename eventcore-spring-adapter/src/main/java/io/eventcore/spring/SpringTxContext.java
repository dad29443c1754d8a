package io.eventcore.spring;

import io.eventcore.spi.TxContext;

import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TxContext} backed by Spring's {@link TransactionSynchronizationManager}.
 *
 * <p>Appends made inside a Spring-managed transaction (for example a {@code @Transactional}
 * method or a {@code TransactionTemplate} callback) are written on the connection Spring bound
 * for {@code dataSource}, so they commit or roll back together with the caller's own writes.
 * The {@code dataSource} must be the same instance the transaction manager manages.
 */
public final class SpringTxContext implements TxContext {
  private final DataSource dataSource;

  public SpringTxContext(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public boolean isTransactionActive() {
    return TransactionSynchronizationManager.isActualTransactionActive();
  }

  @Override
  public Connection currentConnection() {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No Spring transaction is active on this thread");
    }
    return DataSourceUtils.getConnection(dataSource);
  }

  @Override
  public void afterCommit(Runnable callback) {
    register(callback, TransactionSynchronization.STATUS_COMMITTED);
  }

  @Override
  public void afterRollback(Runnable callback) {
    register(callback, TransactionSynchronization.STATUS_ROLLED_BACK);
  }

  private static void register(Runnable callback, int onStatus) {
    Objects.requireNonNull(callback, "callback");
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      throw new IllegalStateException("Transaction synchronization is not active");
    }
    TransactionSynchronizationManager.registerSynchronization(new CompletionCallback(callback, onStatus));
  }

  /** Runs its callback once the transaction completes with the expected status. */
  private static final class CompletionCallback implements TransactionSynchronization {
    private final Runnable callback;
    private final int onStatus;

    CompletionCallback(Runnable callback, int onStatus) {
      this.callback = callback;
      this.onStatus = onStatus;
    }

    @Override
    public void afterCompletion(int status) {
      if (status == onStatus) {
        callback.run();
      }
    }
  }
}
