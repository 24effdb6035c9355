package eventbus;

import java.util.concurrent.CompletableFuture;

/**
 * Something that emits events and reports completion through a future.
 *
 * @see EventEmitter
 */
public interface AsyncEventEmitter {

  /**
   * Emits an event.
   *
   * @param event the event name
   * @param args  the arguments handed to every callback
   * @return a future completing when every callback for the emission has settled
   */
  CompletableFuture<Void> emit(String event, Object... args);
}
