/**
 * Root API for the event bus: an in-process publish/subscribe core with priority-ordered
 * listeners and three dispatch engines.
 *
 * <h2>Core Design</h2>
 * <p>Callbacks are registered against an event name with an optional integer priority
 * (default {@value eventbus.dispatch.BaseEventBus#DEFAULT_PRIORITY}). Callbacks sharing a
 * priority form a <em>group</em>; groups dispatch in ascending priority order and callbacks
 * within a group in registration order. Every emission first dispatches the meta-event
 * {@code "event"} with {@code (eventName, args)}, then the named event.
 *
 * <p>A failing callback never affects its siblings: its exception goes to the bus's
 * {@link eventbus.DispatchErrorHandler}. {@link Error}s are not intercepted.
 *
 * <h2>Engines</h2>
 * <ul>
 *   <li>{@link eventbus.dispatch.EventBus}: blocking, on the caller's thread</li>
 *   <li>{@link eventbus.dispatch.AsyncEventBus}: group-wise fan-out over
 *       {@link java.util.concurrent.CompletableFuture}s</li>
 *   <li>{@link eventbus.dispatch.ThreadedEventBus}: FIFO queue, loop thread, worker pool</li>
 * </ul>
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>eventbus-core</b>: callbacks, registry, buses, eventful objects (zero external deps)</li>
 *   <li><b>eventbus-micrometer</b>: Micrometer bridge for {@link eventbus.spi.MetricsExporter}</li>
 *   <li><b>eventbus-spring-boot-starter</b>: auto-configured bus and eventful binding</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * EventBus bus = EventBus.builder().build();
 * EventCallback audit = bus.on("order.placed", 1, args -> audit(args[0]));
 * bus.on("order.placed", args -> ship(args[0]));
 *
 * bus.emit("order.placed", order);          // audit, then ship
 * bus.removeCallback("order.placed", audit);
 * }</pre>
 */
package eventbus;
