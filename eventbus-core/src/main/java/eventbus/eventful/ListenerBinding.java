package eventbus.eventful;

import eventbus.Callback;

import java.util.Objects;

/**
 * One listener declared by an eventful object.
 *
 * @param event    the event name
 * @param callback the callback
 * @param priority the priority, or {@code null} for the bus default
 */
public record ListenerBinding(String event, Callback callback, Integer priority) {
  public ListenerBinding {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(callback, "callback");
  }
}
