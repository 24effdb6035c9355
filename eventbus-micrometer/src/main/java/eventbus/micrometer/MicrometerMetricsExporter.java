package eventbus.micrometer;

import eventbus.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventbus.emit}: emissions accepted for dispatch</li>
 *   <li>{@code eventbus.emit.dropped}: emissions dropped by a stopped threaded bus</li>
 *   <li>{@code eventbus.listener.success}: callbacks that completed normally</li>
 *   <li>{@code eventbus.listener.failure}: callbacks handed to the error handler</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code eventbus.queue.depth}: emissions waiting in a threaded bus queue</li>
 *   <li>{@code eventbus.listener.duration}: callback execution time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  public static final String DEFAULT_PREFIX = "eventbus";

  private final MeterRegistry registry;
  private final Counter emitted;
  private final Counter dropped;
  private final Counter listenerSuccess;
  private final Counter listenerFailure;
  private final Gauge queueDepthGauge;
  private final Timer listenerDuration;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the metric name prefix {@value #DEFAULT_PREFIX}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several buses.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.eventbus"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.emitted = Counter.builder(namePrefix + ".emit")
        .description("Emissions accepted for dispatch")
        .register(registry);
    this.dropped = Counter.builder(namePrefix + ".emit.dropped")
        .description("Emissions dropped because the bus was stopped")
        .register(registry);
    this.listenerSuccess = Counter.builder(namePrefix + ".listener.success")
        .description("Callbacks that completed normally")
        .register(registry);
    this.listenerFailure = Counter.builder(namePrefix + ".listener.failure")
        .description("Callbacks that failed")
        .register(registry);
    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .description("Emissions waiting for the dispatch loop")
        .register(registry);
    this.listenerDuration = Timer.builder(namePrefix + ".listener.duration")
        .description("Callback execution time")
        .register(registry);
  }

  @Override
  public void incrementEmitted() {
    if (closed) return;
    emitted.increment();
  }

  @Override
  public void incrementDropped() {
    if (closed) return;
    dropped.increment();
  }

  @Override
  public void incrementListenerSuccess() {
    if (closed) return;
    listenerSuccess.increment();
  }

  @Override
  public void incrementListenerFailure() {
    if (closed) return;
    listenerFailure.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordListenerDurationMs(long durationMs) {
    if (closed) return;
    listenerDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this once the bus using the exporter is shut down, so no stale gauge remains.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(emitted, dropped, listenerSuccess, listenerFailure,
        queueDepthGauge, listenerDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
