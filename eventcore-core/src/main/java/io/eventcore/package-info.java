/**
 * Root API for eventcore, an event-sourcing core with an in-process bus and JDBC persistence.
 *
 * <h2>Core Design</h2>
 * <p>Aggregates are rebuilt by folding their {@link io.eventcore.Event events} through
 * reducers, optionally starting from a {@linkplain io.eventcore.snapshot.Snapshot snapshot}.
 * Saving appends the new events to the {@linkplain io.eventcore.store.EventStore event store}
 * with an expected version; a stale writer gets a {@link io.eventcore.ConcurrencyException}.
 * Once the append commits, the {@linkplain io.eventcore.dispatch.EventDispatcher dispatcher}
 * publishes the events on the {@linkplain io.eventcore.bus.EventBus bus}, which delivers
 * them HIGH, NORMAL, then LOW priority.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>eventcore-core</b>: events, bus, store and snapshot APIs with in-memory
 *       implementations, repository, dispatcher</li>
 *   <li><b>eventcore-jdbc</b>: JDBC event and snapshot stores (H2, MySQL, PostgreSQL)</li>
 *   <li><b>eventcore-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>eventcore-spring-adapter</b>: Spring transaction integration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * AggregateDefinition<Integer> counter = AggregateDefinition.<Integer>builder("Counter", () -> 0)
 *     .on("Incremented", (state, event) -> state + 1)
 *     .build();
 *
 * try (EventCore core = EventCore.builder().build()) {
 *   core.bus().subscribe("Incremented", event ->
 *       System.out.println("v" + event.version() + " of " + event.aggregateId()));
 *
 *   EventSourcedRepository<Integer> repository = core.repository(counter);
 *   Aggregate<Integer> aggregate = repository.create("counter-1");
 *   aggregate.raise("Incremented", "{}");
 *   repository.save(aggregate);
 * }
 * }</pre>
 *
 * @see io.eventcore.EventCore
 */
package io.eventcore;
