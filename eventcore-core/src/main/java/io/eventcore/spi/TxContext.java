package io.eventcore.spi;

import java.sql.Connection;

/**
 * View of the caller's current transaction, as seen by stores that want to join it.
 *
 * <p>When {@link #isTransactionActive()} is {@code true}, stores write on
 * {@link #currentConnection()} instead of opening their own connection, and defer
 * publication until the outcome is known through the completion callbacks. Every method
 * except {@code isTransactionActive} throws {@link IllegalStateException} without an active
 * transaction.
 *
 * <p>Implementations: {@code io.eventcore.jdbc.tx.ThreadLocalTxContext} for transactions
 * begun through {@code JdbcTransactionManager}, {@code io.eventcore.spring.SpringTxContext}
 * for Spring-managed ones.
 */
public interface TxContext {

  boolean isTransactionActive();

  /**
   * Returns the connection of the active transaction. Callers must not close or commit it.
   */
  Connection currentConnection();

  /** Runs {@code callback} once the active transaction has committed. */
  void afterCommit(Runnable callback);

  /** Runs {@code callback} once the active transaction has rolled back. */
  void afterRollback(Runnable callback);

  /**
   * Registers one callback per possible outcome of the active transaction.
   */
  default void onCompletion(Runnable onCommit, Runnable onRollback) {
    afterCommit(onCommit);
    afterRollback(onRollback);
  }
}
