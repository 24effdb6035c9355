package eventbus.dispatch;

import eventbus.Callback;
import eventbus.DispatchErrorHandler;
import eventbus.EventCallback;
import eventbus.eventful.AbstractEventful;
import eventbus.eventful.ListenerBinding;
import eventbus.registry.DefaultListenerRegistry;
import eventbus.registry.ListenerRegistry;
import eventbus.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * State and registration logic shared by every bus: the listener registry, the error
 * handler and the metrics exporter.
 *
 * <p>Subclasses define how an emission is executed. Every bus dispatches the meta-event
 * {@value #ANY_EVENT} with the arguments {@code (eventName, args)} before the named event
 * itself, so a single callback can observe all traffic.
 *
 * @see EventBus
 * @see AsyncEventBus
 * @see ThreadedEventBus
 */
public abstract class BaseEventBus {

  /** Priority assigned to callbacks registered without one, unless the builder overrides it. */
  public static final int DEFAULT_PRIORITY = 10_000;

  /** Name of the meta-event dispatched for every emission. */
  public static final String ANY_EVENT = "event";

  private final ListenerRegistry registry;
  private volatile DispatchErrorHandler errorHandler;
  final MetricsExporter metrics;

  BaseEventBus(AbstractBuilder<?> builder) {
    this.registry = new DefaultListenerRegistry(builder.defaultPriority);
    this.errorHandler = builder.errorHandler != null ? builder.errorHandler : new LoggingErrorHandler();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  /**
   * Returns the priority assigned to callbacks registered without one.
   */
  public int defaultPriority() {
    return registry.defaultPriority();
  }

  /**
   * Returns the callbacks of an event grouped by priority, lowest priority value first.
   *
   * @param event the event name
   * @return an immutable snapshot; empty if nothing is registered
   */
  public List<List<Callback>> getCallbacks(String event) {
    return registry.callbacksFor(event);
  }

  /**
   * Registers a callback with the default priority.
   *
   * @param event    the event name
   * @param callback the callback
   * @throws IllegalArgumentException if this bus does not accept the callback's kind
   */
  public void addCallback(String event, Callback callback) {
    addCallback(event, callback, (Integer) null);
  }

  /**
   * Registers a callback, or moves it to a new priority if it is already registered.
   *
   * @param event    the event name
   * @param callback the callback
   * @param priority the priority; lower values are invoked first
   * @throws IllegalArgumentException if this bus does not accept the callback's kind
   */
  public void addCallback(String event, Callback callback, int priority) {
    addCallback(event, callback, Integer.valueOf(priority));
  }

  /**
   * Registers a callback, or moves it to a new priority if it is already registered.
   *
   * @param event    the event name
   * @param callback the callback
   * @param priority the priority, or {@code null} for {@link #defaultPriority()}
   * @throws IllegalArgumentException if this bus does not accept the callback's kind
   */
  public void addCallback(String event, Callback callback, Integer priority) {
    Objects.requireNonNull(event, "event");
    checkAccepted(callback);
    registry.add(event, callback, priority);
  }

  /**
   * Unregisters a callback. Does nothing if it is not registered for the event.
   *
   * @param event    the event name
   * @param callback the callback
   */
  public void removeCallback(String event, Callback callback) {
    registry.remove(event, callback);
  }

  /**
   * Registers a callback with the default priority and returns it, for later removal.
   *
   * @param event    the event name
   * @param callback the callback
   * @return {@code callback}
   */
  public EventCallback on(String event, EventCallback callback) {
    addCallback(event, callback);
    return callback;
  }

  /**
   * Registers a callback with a priority and returns it, for later removal.
   *
   * @param event    the event name
   * @param priority the priority; lower values are invoked first
   * @param callback the callback
   * @return {@code callback}
   */
  public EventCallback on(String event, int priority, EventCallback callback) {
    addCallback(event, callback, priority);
    return callback;
  }

  /**
   * Returns the handler receiving callback failures.
   */
  public DispatchErrorHandler errorHandler() {
    return errorHandler;
  }

  /**
   * Replaces the handler receiving callback failures for this bus.
   *
   * @param errorHandler the new handler
   */
  public void setErrorHandler(DispatchErrorHandler errorHandler) {
    this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
  }

  /**
   * Rejects callbacks this bus cannot invoke. Runs before any state changes.
   *
   * @param callback the callback about to be registered
   */
  void checkAccepted(Callback callback) {
    Objects.requireNonNull(callback, "callback");
  }

  <E> void bind(AbstractEventful<E> eventful, E bus) {
    Objects.requireNonNull(eventful, "eventful");
    List<ListenerBinding> bindings = eventful.getListeners();
    for (ListenerBinding binding : bindings) {
      checkAccepted(binding.callback());
    }
    eventful.addEventBus(bus);
    for (ListenerBinding binding : bindings) {
      registry.add(binding.event(), binding.callback(), binding.priority());
    }
  }

  <E> void unbind(AbstractEventful<E> eventful, E bus) {
    Objects.requireNonNull(eventful, "eventful");
    for (ListenerBinding binding : eventful.getListeners()) {
      registry.remove(binding.event(), binding.callback());
    }
    eventful.removeEventBus(bus);
  }

  /**
   * Invokes an immediate callback on the current thread, routing its failure to the
   * error handler.
   *
   * @throws DispatchInterruptedException if the callback was interrupted
   */
  final void invoke(String event, EventCallback callback, Object[] args, List<Object> argList) {
    long start = System.nanoTime();
    try {
      callback.call(args);
      metrics.incrementListenerSuccess();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DispatchInterruptedException(event, e);
    } catch (Exception e) {
      reportFailure(event, e, argList);
    } finally {
      metrics.recordListenerDurationMs(elapsedMs(start));
    }
  }

  final void reportFailure(String event, Exception error, List<Object> argList) {
    metrics.incrementListenerFailure();
    errorHandler.onError(event, error, argList);
  }

  static long elapsedMs(long startNanos) {
    return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
  }

  static Object[] copyArgs(Object[] args) {
    return args == null ? new Object[0] : args.clone();
  }

  static List<Object> argList(Object[] args) {
    return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args)));
  }

  static Object[] metaArgs(String event, Object[] args) {
    return new Object[] {event, argList(args)};
  }

  /**
   * Base builder with the settings every bus shares.
   *
   * @param <B> the concrete builder type (CRTP)
   */
  public abstract static sealed class AbstractBuilder<B extends AbstractBuilder<B>>
      permits EventBus.Builder, AsyncEventBus.Builder, ThreadedEventBus.Builder {

    int defaultPriority = DEFAULT_PRIORITY;
    DispatchErrorHandler errorHandler;
    MetricsExporter metrics;

    AbstractBuilder() {}

    @SuppressWarnings("unchecked")
    private B self() {
      return (B) this;
    }

    /**
     * Sets the priority assigned to callbacks registered without one.
     *
     * <p>Optional. Defaults to {@value BaseEventBus#DEFAULT_PRIORITY}.
     *
     * @param defaultPriority the default priority
     * @return this builder
     */
    public B defaultPriority(int defaultPriority) {
      this.defaultPriority = defaultPriority;
      return self();
    }

    /**
     * Sets the handler receiving callback failures.
     *
     * <p>Optional. Defaults to a {@link LoggingErrorHandler}.
     *
     * @param errorHandler the error handler
     * @return this builder
     */
    public B errorHandler(DispatchErrorHandler errorHandler) {
      this.errorHandler = errorHandler;
      return self();
    }

    /**
     * Sets the metrics exporter for dispatch counters.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public B metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return self();
    }
  }
}
