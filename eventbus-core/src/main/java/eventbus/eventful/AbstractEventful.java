package eventbus.eventful;

import eventbus.Callback;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Base for objects that declare a fixed set of listeners and can be bound to buses in bulk.
 *
 * <p>Subclasses declare their listeners by calling {@link #listen} from their constructor.
 * The declared callbacks are kept as-is, so unbinding removes exactly the references that
 * binding registered.
 *
 * <p>The set of bound buses is not thread-safe. Bind and unbind calls for one eventful
 * must not run concurrently.
 *
 * @param <E> the emitter type of the buses this eventful binds to
 */
public abstract class AbstractEventful<E> {
  private final List<ListenerBinding> listeners = new ArrayList<>();
  private final Set<E> eventBuses = new LinkedHashSet<>();

  protected AbstractEventful() {}

  /**
   * Declares a listener with the bus's default priority.
   */
  protected final void listen(String event, Callback callback) {
    listeners.add(new ListenerBinding(event, callback, null));
  }

  /**
   * Declares a listener with an explicit priority.
   */
  protected final void listen(String event, Callback callback, int priority) {
    listeners.add(new ListenerBinding(event, callback, priority));
  }

  /**
   * Returns the declared listeners in declaration order.
   */
  public List<ListenerBinding> getListeners() {
    return List.copyOf(listeners);
  }

  /**
   * Returns the buses this eventful is bound to, in binding order.
   */
  public Set<E> getEventBuses() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(eventBuses));
  }

  public void addEventBus(E eventBus) {
    eventBuses.add(Objects.requireNonNull(eventBus, "eventBus"));
  }

  public void removeEventBus(E eventBus) {
    eventBuses.remove(eventBus);
  }
}
