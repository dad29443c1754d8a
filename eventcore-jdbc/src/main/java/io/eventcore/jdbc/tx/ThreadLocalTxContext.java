package io.eventcore.jdbc.tx;

import io.eventcore.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TxContext} that keeps the current connection and its completion callbacks in a
 * {@link ThreadLocal}.
 *
 * <p>Bound and cleared by {@link JdbcTransactionManager}; application code only reads it.
 * Callbacks run in registration order. If several fail, the first failure is rethrown with
 * the others attached as suppressed exceptions, and the context is cleared regardless.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext implements TxContext {
  private final ThreadLocal<Binding> current = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return current.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return require().connection;
  }

  @Override
  public void afterCommit(Runnable callback) {
    require().onCommit.add(callback);
  }

  @Override
  public void afterRollback(Runnable callback) {
    require().onRollback.add(callback);
  }

  void bind(Connection connection) {
    if (current.get() != null) {
      throw new IllegalStateException("Transaction already active on this thread");
    }
    current.set(new Binding(connection));
  }

  void completeCommitted() {
    complete(true);
  }

  void completeRolledBack() {
    complete(false);
  }

  private void complete(boolean committed) {
    Binding binding = current.get();
    if (binding == null) {
      return;
    }
    current.remove();
    RuntimeException first = null;
    for (Runnable callback : committed ? binding.onCommit : binding.onRollback) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  private Binding require() {
    Binding binding = current.get();
    if (binding == null) {
      throw new IllegalStateException("No active transaction");
    }
    return binding;
  }

  private static final class Binding {
    private final Connection connection;
    private final List<Runnable> onCommit = new ArrayList<>();
    private final List<Runnable> onRollback = new ArrayList<>();

    private Binding(Connection connection) {
      this.connection = connection;
    }
  }
}
