package eventbus.dispatch;

/**
 * Thrown when a callback running on the emitting thread is interrupted. The thread's
 * interrupt status is restored and the rest of the emission is abandoned.
 */
public class DispatchInterruptedException extends RuntimeException {
  private final String event;

  public DispatchInterruptedException(String event, InterruptedException cause) {
    super("Interrupted while dispatching '" + event + "'", cause);
    this.event = event;
  }

  /** Returns the event being dispatched when the interrupt happened. */
  public String event() {
    return event;
  }
}
