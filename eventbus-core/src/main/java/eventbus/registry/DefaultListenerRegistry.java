package eventbus.registry;

import eventbus.Callback;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Lock-guarded registry that keeps a sorted listener list per event and a cached,
 * immutable grouping of it for dispatch.
 *
 * <p>Every mutation rebuilds the cached groups of the affected event and replaces them
 * with a new immutable list. Readers take the lock only to copy out that reference, so a
 * dispatch iterating a snapshot is never affected by a concurrent registration.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ListenerRegistry registry = new DefaultListenerRegistry(10_000);
 * registry.add("greet", greeter, 1);
 * registry.add("greet", logger, null);      // default priority
 * registry.callbacksFor("greet");           // [[greeter], [logger]]
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>This implementation is thread-safe. A single monitor serializes mutations and
 * snapshot reads; registration is expected to be rare compared to dispatch.
 */
public final class DefaultListenerRegistry implements ListenerRegistry {

  private final int defaultPriority;
  private final Object lock = new Object();
  private final Map<String, List<Listener>> sortedListeners = new HashMap<>();
  private final Map<String, List<List<Callback>>> cachedGroups = new HashMap<>();

  /**
   * Creates a registry.
   *
   * @param defaultPriority the priority assigned when a registration supplies none
   */
  public DefaultListenerRegistry(int defaultPriority) {
    this.defaultPriority = defaultPriority;
  }

  @Override
  public int defaultPriority() {
    return defaultPriority;
  }

  @Override
  public List<List<Callback>> callbacksFor(String event) {
    List<List<Callback>> groups;
    synchronized (lock) {
      groups = cachedGroups.get(event);
    }
    return groups != null ? groups : List.of();
  }

  @Override
  public void add(String event, Callback callback, Integer priority) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(callback, "callback");
    Listener listener = new Listener(callback, priority != null ? priority : defaultPriority);

    synchronized (lock) {
      List<Listener> listeners = sortedListeners.computeIfAbsent(event, ignored -> new ArrayList<>());
      listeners.removeIf(existing -> existing.sameCallback(callback));
      listeners.add(insertionPoint(listeners, listener.priority()), listener);
      cachedGroups.put(event, group(listeners));
    }
  }

  @Override
  public void remove(String event, Callback callback) {
    if (event == null || callback == null) {
      return;
    }
    synchronized (lock) {
      List<Listener> listeners = sortedListeners.get(event);
      if (listeners == null) {
        return;
      }
      if (listeners.removeIf(existing -> existing.sameCallback(callback))) {
        cachedGroups.put(event, group(listeners));
      }
      if (listeners.isEmpty()) {
        sortedListeners.remove(event);
        cachedGroups.remove(event);
      }
    }
  }

  @Override
  public Set<String> events() {
    synchronized (lock) {
      return Set.copyOf(sortedListeners.keySet());
    }
  }

  // Index after the last listener whose priority is <= the given one (stable insert).
  private static int insertionPoint(List<Listener> listeners, int priority) {
    int low = 0;
    int high = listeners.size();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (priority < listeners.get(mid).priority()) {
        high = mid;
      } else {
        low = mid + 1;
      }
    }
    return low;
  }

  private static List<List<Callback>> group(List<Listener> listeners) {
    List<List<Callback>> groups = new ArrayList<>();
    List<Callback> current = null;
    int currentPriority = 0;
    for (Listener listener : listeners) {
      if (current == null || listener.priority() != currentPriority) {
        if (current != null) {
          groups.add(List.copyOf(current));
        }
        current = new ArrayList<>();
        currentPriority = listener.priority();
      }
      current.add(listener.callback());
    }
    if (current != null) {
      groups.add(List.copyOf(current));
    }
    return List.copyOf(groups);
  }
}
