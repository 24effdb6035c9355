package eventbus.registry;

import eventbus.Callback;

import java.util.Objects;

/**
 * A callback registered for an event together with its priority.
 *
 * <p>Two listeners denote the same registration when their callbacks are the same
 * reference; see {@link #sameCallback(Callback)}. Record equality, which also compares
 * priorities, is not used for that purpose.
 */
public record Listener(Callback callback, int priority) {

  public Listener {
    Objects.requireNonNull(callback, "callback");
  }

  boolean sameCallback(Callback other) {
    return callback == other;
  }
}
