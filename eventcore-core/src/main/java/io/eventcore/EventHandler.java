package io.eventcore;

/**
 * Handler that reacts to events delivered by an {@link io.eventcore.bus.EventBus}.
 *
 * <h2>Execution Model</h2>
 * <p>Synchronous publishes run handlers on the publishing thread, in priority order.
 * Asynchronous publishes run handlers of the same priority tier concurrently on the
 * bus executor; handlers must therefore be thread-safe if they share state.
 *
 * <h2>Error Handling</h2>
 * <p>An exception thrown by a handler is isolated: it is wrapped in a
 * {@link HandlerExecutionException}, logged, and reported in the
 * {@link io.eventcore.bus.PublishResult}. Other handlers still run. The bus never
 * retries; wrap a handler in {@link io.eventcore.bus.RetryingEventHandler} for that.
 *
 * <h2>Cancellation</h2>
 * <p>Handlers running under an asynchronous publish may be interrupted when the
 * publish timeout elapses. Blocking handlers should respond to interruption.
 *
 * @see io.eventcore.bus.EventBus
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * Processes an event.
   *
   * @param event the delivered event
   * @throws Exception if processing fails; the failure is captured, never propagated to the publisher
   */
  void handle(Event event) throws Exception;
}
