package eventbus;

/**
 * Callback that does all of its work before returning.
 *
 * <p>Accepted by every bus. On the {@linkplain eventbus.dispatch.ThreadedEventBus threaded
 * bus} it runs on a worker thread; on the other buses it runs on the dispatching thread.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * bus.addCallback("greet", (EventCallback) args -> System.out.println("Hello " + args[0]));
 * }</pre>
 */
@FunctionalInterface
public non-sealed interface EventCallback extends Callback {

  /**
   * Handles one emission.
   *
   * @param args the arguments passed to {@code emit}
   * @throws Exception if handling fails; the bus routes it to its error handler
   */
  void call(Object... args) throws Exception;
}
