package eventbus.spring.boot;

import eventbus.micrometer.MicrometerMetricsExporter;
import eventbus.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Publishes event bus dispatch figures to the application's {@link MeterRegistry}.
 *
 * <p>Registers a {@link MicrometerMetricsExporter} as the bus {@link MetricsExporter} once a
 * registry bean is present. The exporter records accepted emissions ({@code <prefix>.emit}),
 * emissions refused by a stopped bus ({@code <prefix>.emit.dropped}), listener outcomes
 * ({@code <prefix>.listener.success}, {@code <prefix>.listener.failure}), listener run time
 * ({@code <prefix>.listener.duration}) and the threaded bus backlog ({@code <prefix>.queue.depth}).
 *
 * <p>The prefix comes from {@code eventbus.metrics.name-prefix} and defaults to {@code eventbus}.
 * Setting {@code eventbus.metrics.enabled=false} leaves the bus on the no-op exporter. A
 * user-defined {@link MetricsExporter} bean always wins.
 */
@AutoConfiguration(before = EventBusAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "eventbus.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(EventBusProperties.class)
public class EventBusMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, EventBusProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
