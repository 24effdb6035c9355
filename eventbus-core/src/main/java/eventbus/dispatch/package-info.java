/**
 * The three dispatch engines.
 *
 * <ul>
 *   <li>{@link eventbus.dispatch.EventBus} runs every callback on the emitting thread.</li>
 *   <li>{@link eventbus.dispatch.AsyncEventBus} fans each priority group out and joins the
 *       returned stages before the next group.</li>
 *   <li>{@link eventbus.dispatch.ThreadedEventBus} queues emissions for a loop thread that
 *       runs each group on a worker pool.</li>
 * </ul>
 *
 * <p>Callback failures are isolated and reported to the bus's
 * {@link eventbus.DispatchErrorHandler}; the default one is
 * {@link eventbus.dispatch.LoggingErrorHandler}.
 */
package eventbus.dispatch;
