/**
 * Spring Boot auto-configuration for the event bus.
 *
 * <p>Add the starter and inject the bus:
 * <pre>{@code
 * eventbus.mode=THREADED
 * eventbus.threaded.max-workers=8
 * }</pre>
 * Beans extending {@link eventbus.eventful.Eventful} or
 * {@link eventbus.eventful.AsyncEventful} are bound to the bus automatically.
 *
 * @see eventbus.spring.boot.EventBusProperties
 */
package eventbus.spring.boot;
