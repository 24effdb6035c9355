package eventbus.eventful;

import eventbus.AsyncEventEmitter;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Eventful object for {@link eventbus.dispatch.AsyncEventBus}es. Both callback kinds may be
 * declared.
 */
public abstract class AsyncEventful extends AbstractEventful<AsyncEventEmitter> {

  /**
   * Starts the emission on every bound bus.
   *
   * @return a future completing once every bus has finished dispatching
   */
  public CompletableFuture<Void> emit(String event, Object... args) {
    Set<AsyncEventEmitter> buses = getEventBuses();
    CompletableFuture<?>[] emissions = new CompletableFuture<?>[buses.size()];
    int i = 0;
    for (AsyncEventEmitter bus : buses) {
      emissions[i++] = bus.emit(event, args);
    }
    return CompletableFuture.allOf(emissions);
  }
}
