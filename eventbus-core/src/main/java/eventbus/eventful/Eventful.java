package eventbus.eventful;

import eventbus.EventEmitter;

/**
 * Eventful object for blocking and threaded buses.
 *
 * <pre>{@code
 * class AuditLog extends Eventful {
 *   AuditLog() {
 *     listen("user.created", (EventCallback) args -> record("created", args[0]));
 *     listen("user.deleted", (EventCallback) args -> record("deleted", args[0]), 100);
 *   }
 * }
 *
 * bus.bindEventful(new AuditLog());
 * }</pre>
 */
public abstract class Eventful extends AbstractEventful<EventEmitter> {

  /**
   * Emits the event on every bus this object is bound to, in binding order.
   */
  public void emit(String event, Object... args) {
    for (EventEmitter bus : getEventBuses()) {
      bus.emit(event, args);
    }
  }
}
