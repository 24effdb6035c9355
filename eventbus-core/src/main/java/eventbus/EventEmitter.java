package eventbus;

/**
 * Something that emits events and returns once the emission was accepted.
 *
 * @see AsyncEventEmitter
 */
public interface EventEmitter {

  /**
   * Emits an event.
   *
   * @param event the event name
   * @param args  the arguments handed to every callback
   */
  void emit(String event, Object... args);
}
