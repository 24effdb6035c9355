/**
 * Micrometer bridge for bus metrics.
 *
 * <p>{@link eventbus.micrometer.MicrometerMetricsExporter} implements the
 * {@link eventbus.spi.MetricsExporter} SPI with Micrometer counters, a gauge and a timer.
 * Pass it to a bus builder's {@code metrics(...)}.
 */
package eventbus.micrometer;
