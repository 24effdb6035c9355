package eventbus;

import java.util.concurrent.CompletionStage;

/**
 * Callback whose work completes asynchronously.
 *
 * <p>Only the {@linkplain eventbus.dispatch.AsyncEventBus async bus} accepts these. The
 * other buses reject them when they are added.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * asyncBus.addCallback("order.placed", (AsyncEventCallback) args ->
 *     httpClient.sendAsync(requestFor(args[0]), BodyHandlers.discarding()));
 * }</pre>
 */
@FunctionalInterface
public non-sealed interface AsyncEventCallback extends Callback {

  /**
   * Starts handling one emission.
   *
   * @param args the arguments passed to {@code emit}
   * @return a stage that completes when handling is done; {@code null} means already done
   * @throws Exception if handling fails before any stage is produced
   */
  CompletionStage<?> call(Object... args) throws Exception;
}
