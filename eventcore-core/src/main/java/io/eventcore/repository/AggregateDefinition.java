package io.eventcore.repository;

import io.eventcore.ConfigurationException;
import io.eventcore.EventType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Behaviour of one aggregate type: its initial state, an explicit table of reducers keyed
 * by event type, and an optional serializer for snapshots.
 *
 * <pre>{@code
 * AggregateDefinition<Account> accounts = AggregateDefinition.builder("Account", Account::empty)
 *     .on("AccountOpened", (state, event) -> state.open(event.payloadJson()))
 *     .on("FundsDeposited", (state, event) -> state.deposit(event.payloadJson()))
 *     .serializer(new AccountSerializer())
 *     .build();
 * }</pre>
 *
 * @param <S> the aggregate state type
 */
public final class AggregateDefinition<S> {
  private final String aggregateType;
  private final Supplier<S> initialState;
  private final Map<String, Reducer<S>> reducers;
  private final StateSerializer<S> serializer;

  private AggregateDefinition(Builder<S> builder) {
    this.aggregateType = builder.aggregateType;
    this.initialState = builder.initialState;
    this.reducers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.reducers));
    this.serializer = builder.serializer;
  }

  /**
   * Starts a definition.
   *
   * @param aggregateType the aggregate type name stamped on raised events and snapshots
   * @param initialState  supplies the state of an aggregate before its first event
   * @param <S>           the aggregate state type
   * @return a new builder
   */
  public static <S> Builder<S> builder(String aggregateType, Supplier<S> initialState) {
    return new Builder<>(aggregateType, initialState);
  }

  public String aggregateType() {
    return aggregateType;
  }

  public S initialState() {
    return initialState.get();
  }

  /**
   * Returns the reducer registered for an event type, or {@code null}.
   *
   * @param eventType the event type name
   * @return the reducer, or {@code null} if none is registered
   */
  public Reducer<S> reducerFor(String eventType) {
    return reducers.get(eventType);
  }

  public Map<String, Reducer<S>> reducers() {
    return reducers;
  }

  /**
   * Returns the snapshot serializer, or {@code null} if this aggregate is never snapshotted.
   */
  public StateSerializer<S> serializer() {
    return serializer;
  }

  /** Builder for {@link AggregateDefinition}. */
  public static final class Builder<S> {
    private final String aggregateType;
    private final Supplier<S> initialState;
    private final Map<String, Reducer<S>> reducers = new LinkedHashMap<>();
    private StateSerializer<S> serializer;

    private Builder(String aggregateType, Supplier<S> initialState) {
      if (aggregateType == null || aggregateType.isEmpty()) {
        throw new ConfigurationException("aggregateType cannot be null or empty");
      }
      this.aggregateType = aggregateType;
      this.initialState = Objects.requireNonNull(initialState, "initialState");
    }

    /**
     * Registers the reducer for an event type.
     *
     * @param eventType the event type name
     * @param reducer   the state transition
     * @return this builder
     * @throws ConfigurationException if a reducer is already registered for the type
     */
    public Builder<S> on(String eventType, Reducer<S> reducer) {
      Objects.requireNonNull(eventType, "eventType");
      Objects.requireNonNull(reducer, "reducer");
      if (reducers.putIfAbsent(eventType, reducer) != null) {
        throw new ConfigurationException("Duplicate reducer for event type " + eventType
            + " on aggregate " + aggregateType);
      }
      return this;
    }

    public Builder<S> on(EventType eventType, Reducer<S> reducer) {
      Objects.requireNonNull(eventType, "eventType");
      return on(eventType.name(), reducer);
    }

    /**
     * Sets the snapshot serializer.
     *
     * <p>Optional. Without one the aggregate is always rebuilt from its full stream.
     *
     * @param serializer the state serializer
     * @return this builder
     */
    public Builder<S> serializer(StateSerializer<S> serializer) {
      this.serializer = serializer;
      return this;
    }

    /**
     * @throws ConfigurationException if no reducer was registered
     */
    public AggregateDefinition<S> build() {
      if (reducers.isEmpty()) {
        throw new ConfigurationException("Aggregate " + aggregateType + " has no reducers");
      }
      return new AggregateDefinition<>(this);
    }
  }
}
