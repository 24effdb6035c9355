/**
 * Objects that declare several listeners once and bind them to buses in bulk.
 *
 * @see eventbus.eventful.Eventful
 * @see eventbus.eventful.AsyncEventful
 */
package eventbus.eventful;
