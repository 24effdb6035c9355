package eventbus;

import java.util.List;

/**
 * Receives the failures of individual callbacks during dispatch.
 *
 * <p>Each bus holds its own handler, set through its builder or
 * {@code setErrorHandler}. A failing callback never stops the remaining callbacks of an
 * emission; the handler is called once per failure instead.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventBus bus = EventBus.builder()
 *     .errorHandler((event, error, args) -> failures.add(event))
 *     .build();
 * }</pre>
 *
 * @see eventbus.dispatch.LoggingErrorHandler
 */
@FunctionalInterface
public interface DispatchErrorHandler {

  /**
   * Handles one callback failure.
   *
   * @param event the event being dispatched when the callback failed
   * @param error the exception raised by the callback
   * @param args  the arguments the callback was invoked with (unmodifiable)
   */
  void onError(String event, Exception error, List<Object> args);
}
