/**
 * Listener storage: callbacks per event name, grouped and ordered by priority.
 *
 * <p>Each bus owns one {@link eventbus.registry.ListenerRegistry}. Dispatch reads
 * immutable group snapshots, so registrations may change while an emission is running.
 *
 * @see eventbus.registry.ListenerRegistry
 * @see eventbus.registry.DefaultListenerRegistry
 */
package eventbus.registry;
