package eventbus.spring.boot;

import eventbus.DispatchErrorHandler;
import eventbus.dispatch.AsyncEventBus;
import eventbus.dispatch.BaseEventBus;
import eventbus.dispatch.EventBus;
import eventbus.dispatch.ThreadedEventBus;
import eventbus.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the event bus.
 *
 * <p>Creates one bus for the configured {@link EventBusProperties.Mode} and binds every
 * {@link eventbus.eventful.Eventful} or {@link eventbus.eventful.AsyncEventful} bean to it.
 * A {@link DispatchErrorHandler} or {@link MetricsExporter} bean is picked up when present.
 * The threaded bus is started on creation and shut down with the context.
 *
 * @see EventBusProperties
 * @see EventBusMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(BaseEventBus.class)
@EnableConfigurationProperties(EventBusProperties.class)
public class EventBusAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(BaseEventBus.class)
  public BaseEventBus eventBus(EventBusProperties props,
      ObjectProvider<DispatchErrorHandler> errorHandlerProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    DispatchErrorHandler errorHandler = errorHandlerProvider.getIfAvailable();
    MetricsExporter metrics = metricsProvider.getIfAvailable();

    return switch (props.getMode()) {
      case BLOCKING -> EventBus.builder()
          .defaultPriority(props.getDefaultPriority())
          .errorHandler(errorHandler)
          .metrics(metrics)
          .build();
      case ASYNC -> AsyncEventBus.builder()
          .defaultPriority(props.getDefaultPriority())
          .errorHandler(errorHandler)
          .metrics(metrics)
          .build();
      case THREADED -> ThreadedEventBus.builder()
          .defaultPriority(props.getDefaultPriority())
          .errorHandler(errorHandler)
          .metrics(metrics)
          .maxWorkers(props.getThreaded().getMaxWorkers())
          .build()
          .open();
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public EventfulRegistrar eventfulRegistrar(ListableBeanFactory beanFactory, BaseEventBus eventBus) {
    return new EventfulRegistrar(beanFactory, eventBus);
  }
}
