package eventbus;

/**
 * A function bound to an event name.
 *
 * <p>The kind of a callback is fixed by its type: an {@link EventCallback} completes
 * before it returns, an {@link AsyncEventCallback} returns a stage that completes later.
 * Buses decide once, at registration time, whether they accept a kind.
 *
 * <p>Callbacks are identified by reference. Registering the same instance twice for
 * one event moves it rather than adding a second entry, so keep the instance if you
 * intend to remove it later.
 *
 * @see EventCallback
 * @see AsyncEventCallback
 */
public sealed interface Callback permits EventCallback, AsyncEventCallback {
}
