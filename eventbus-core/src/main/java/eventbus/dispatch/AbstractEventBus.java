package eventbus.dispatch;

import eventbus.AsyncEventCallback;
import eventbus.Callback;
import eventbus.EventEmitter;
import eventbus.eventful.Eventful;

/**
 * Base for the buses that invoke callbacks to completion before moving on, and therefore
 * accept only {@link eventbus.EventCallback}s.
 */
public abstract sealed class AbstractEventBus extends BaseEventBus implements EventEmitter
    permits EventBus, ThreadedEventBus {

  AbstractEventBus(AbstractBuilder<?> builder) {
    super(builder);
  }

  @Override
  void checkAccepted(Callback callback) {
    super.checkAccepted(callback);
    if (callback instanceof AsyncEventCallback) {
      throw new IllegalArgumentException(
          getClass().getSimpleName() + " cannot invoke asynchronous callback " + callback);
    }
  }

  /**
   * Registers every listener declared by {@code eventful} and records this bus on it.
   * Nothing is registered if any declared callback is asynchronous.
   *
   * @param eventful the eventful to bind
   * @throws IllegalArgumentException if a declared callback is asynchronous
   */
  public void bindEventful(Eventful eventful) {
    bind(eventful, this);
  }

  /**
   * Removes every listener declared by {@code eventful} and forgets this bus on it.
   *
   * @param eventful the eventful to unbind
   */
  public void unbindEventful(Eventful eventful) {
    unbind(eventful, this);
  }
}
