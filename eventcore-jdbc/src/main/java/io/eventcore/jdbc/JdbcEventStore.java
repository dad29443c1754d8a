package io.eventcore.jdbc;

import io.eventcore.ConcurrencyException;
import io.eventcore.Event;
import io.eventcore.StoreUnavailableException;
import io.eventcore.jdbc.store.AbstractJdbcEventStreamStore;
import io.eventcore.spi.ConnectionProvider;
import io.eventcore.spi.TxContext;
import io.eventcore.store.AppendListener;
import io.eventcore.store.EventSequence;
import io.eventcore.store.EventStore;
import io.eventcore.store.EventStreams;
import io.eventcore.store.StoredEvent;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventStore} backed by a relational events table.
 *
 * <p>If a {@link TxContext} is configured and a transaction is active on the calling
 * thread, appends and reads use that transaction's connection and
 * {@link AppendListener#afterCommit} is deferred until it commits. Otherwise each append runs
 * in its own transaction on a connection from the {@link ConnectionProvider}.
 *
 * <p>An append first compares the stream's current version with the expected one and then
 * inserts the events. Two writers that pass the check concurrently collide on the
 * {@code (aggregate_id, version)} unique constraint; the loser gets a
 * {@link ConcurrencyException} and its transaction writes nothing.
 *
 * <pre>{@code
 * JdbcEventStore store = JdbcEventStore.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .streamStore(JdbcEventStreamStores.detect(dataSource))
 *     .txContext(txContext)
 *     .listener(dispatcher)
 *     .build();
 * }</pre>
 */
public final class JdbcEventStore implements EventStore {
  private static final Logger logger = Logger.getLogger(JdbcEventStore.class.getName());

  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcEventStreamStore streamStore;
  private final TxContext txContext;
  private final AppendListener listener;
  private final int pageSize;

  private JdbcEventStore(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.streamStore = Objects.requireNonNull(builder.streamStore, "streamStore");
    this.txContext = builder.txContext;
    this.listener = builder.listener != null ? builder.listener : AppendListener.NOOP;
    if (builder.pageSize < 1) {
      throw new IllegalArgumentException("pageSize must be >= 1");
    }
    this.pageSize = builder.pageSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  public AbstractJdbcEventStreamStore streamStore() {
    return streamStore;
  }

  @Override
  public long appendAll(String aggregateId, List<Event> events, long expectedVersion) {
    List<Event> prepared = EventStreams.prepare(aggregateId, events, expectedVersion);
    if (prepared.isEmpty()) {
      return expectedVersion;
    }
    if (txContext != null && txContext.isTransactionActive()) {
      write(txContext.currentConnection(), aggregateId, prepared, expectedVersion);
      txContext.onCompletion(
          () -> runSafely("afterCommit", () -> listener.afterCommit(prepared)),
          () -> runSafely("afterRollback", () -> listener.afterRollback(prepared)));
    } else {
      appendInOwnTransaction(aggregateId, prepared, expectedVersion);
      runSafely("afterCommit", () -> listener.afterCommit(prepared));
    }
    return expectedVersion + prepared.size();
  }

  private void appendInOwnTransaction(String aggregateId, List<Event> prepared, long expectedVersion) {
    try (Connection conn = openConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      boolean written = false;
      try {
        write(conn, aggregateId, prepared, expectedVersion);
        written = true;
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn, e);
        if (written) {
          runSafely("afterRollback", () -> listener.afterRollback(prepared));
        }
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw JdbcTemplate.translate("Failed to append to aggregate " + aggregateId, e);
    }
  }

  private void write(Connection conn, String aggregateId, List<Event> prepared, long expectedVersion) {
    long actual = streamStore.currentVersion(conn, aggregateId);
    if (actual != expectedVersion) {
      throw new ConcurrencyException(aggregateId, expectedVersion, actual);
    }
    try {
      streamStore.insertEvents(conn, prepared);
    } catch (EventStoreException e) {
      if (e.getCause() instanceof SQLException sql && streamStore.isUniqueViolation(sql)) {
        throw new ConcurrencyException(aggregateId, expectedVersion, sql);
      }
      throw e;
    }
    runSafely("afterAppend", () -> listener.afterAppend(prepared));
  }

  @Override
  public List<Event> getEvents(String aggregateId, long sinceVersion) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    return events(withConnection(conn -> streamStore.selectStream(conn, aggregateId, sinceVersion)));
  }

  @Override
  public EventSequence getEventsByType(String eventType, Instant since) {
    Objects.requireNonNull(eventType, "eventType");
    long upperBound = withConnection(streamStore::maxPosition);
    return new EventSequence((after, upTo, limit) -> withConnection(conn ->
        streamStore.selectByType(conn, eventType, since, after, upTo, limit)), upperBound, pageSize);
  }

  @Override
  public List<Event> getEventsByCorrelationId(String correlationId) {
    Objects.requireNonNull(correlationId, "correlationId");
    return events(withConnection(conn -> streamStore.selectByCorrelationId(conn, correlationId)));
  }

  @Override
  public List<Event> getLatestEvents(int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
    }
    List<Event> newestFirst = events(withConnection(conn -> streamStore.selectLatest(conn, limit)));
    Collections.reverse(newestFirst);
    return newestFirst;
  }

  @Override
  public long currentVersion(String aggregateId) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    return withConnection(conn -> streamStore.currentVersion(conn, aggregateId));
  }

  private <T> T withConnection(Function<Connection, T> work) {
    if (txContext != null && txContext.isTransactionActive()) {
      return work.apply(txContext.currentConnection());
    }
    try (Connection conn = openConnection()) {
      return work.apply(conn);
    } catch (SQLException e) {
      throw JdbcTemplate.translate("Failed to release connection", e);
    }
  }

  private Connection openConnection() {
    try {
      return connectionProvider.getConnection();
    } catch (SQLException e) {
      throw new StoreUnavailableException("Failed to obtain connection", e);
    }
  }

  private static List<Event> events(List<StoredEvent> stored) {
    List<Event> events = new ArrayList<>(stored.size());
    for (StoredEvent s : stored) {
      events.add(s.event());
    }
    return events;
  }

  private static void rollbackQuietly(Connection conn, Exception failure) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  private static void runSafely(String phase, Runnable action) {
    try {
      action.run();
    } catch (RuntimeException ex) {
      logger.log(Level.WARNING, "AppendListener " + phase + " failed", ex);
    }
  }

  /** Builder for {@link JdbcEventStore}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private AbstractJdbcEventStreamStore streamStore;
    private TxContext txContext;
    private AppendListener listener;
    private int pageSize = 256;

    private Builder() {}

    /**
     * Sets the source of connections for work outside a caller transaction.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the database-specific SQL, usually from {@code JdbcEventStreamStores.detect(...)}.
     *
     * <p><b>Required.</b>
     *
     * @param streamStore the event stream store
     * @return this builder
     */
    public Builder streamStore(AbstractJdbcEventStreamStore streamStore) {
      this.streamStore = streamStore;
      return this;
    }

    /**
     * Sets the transaction context whose active transaction appends join.
     *
     * <p>Optional. Without one every append runs in its own transaction.
     *
     * @param txContext the transaction context
     * @return this builder
     */
    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link AppendListener#NOOP}.
     */
    public Builder listener(AppendListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Sets how many rows {@link JdbcEventStore#getEventsByType} reads per query.
     *
     * <p>Optional. Defaults to {@code 256}. Must be &ge; 1.
     *
     * @param pageSize rows per page
     * @return this builder
     */
    public Builder pageSize(int pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    /**
     * @throws NullPointerException if {@code connectionProvider} or {@code streamStore} is null
     * @throws IllegalArgumentException if {@code pageSize < 1}
     */
    public JdbcEventStore build() {
      return new JdbcEventStore(this);
    }
  }
}
