/**
 * Service provider interfaces implemented outside the core.
 *
 * @see eventbus.spi.MetricsExporter
 */
package eventbus.spi;
