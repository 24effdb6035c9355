package eventbus.registry;

import eventbus.Callback;

import java.util.List;
import java.util.Set;

/**
 * Stores callbacks per event name, ordered by priority.
 *
 * <p>Callbacks are grouped by priority. Groups are ordered by ascending priority value
 * and a group lists its callbacks in registration order. Lower values dispatch first.
 *
 * @see DefaultListenerRegistry
 */
public interface ListenerRegistry {

  /**
   * Returns the callbacks of an event grouped by priority.
   *
   * @param event the event name
   * @return immutable groups ordered by ascending priority; empty if nothing is registered
   */
  List<List<Callback>> callbacksFor(String event);

  /**
   * Registers a callback, or moves it if it is already registered for the event.
   *
   * @param event    the event name
   * @param callback the callback
   * @param priority the priority, or {@code null} for {@link #defaultPriority()}
   */
  void add(String event, Callback callback, Integer priority);

  /**
   * Unregisters a callback. Does nothing if it is not registered for the event.
   *
   * @param event    the event name
   * @param callback the callback
   */
  void remove(String event, Callback callback);

  /**
   * Returns the priority used when {@link #add} is given none.
   */
  int defaultPriority();

  /**
   * Returns the names of all events that currently have at least one callback.
   */
  Set<String> events();
}
