package eventbus.spring.boot;

import eventbus.AsyncEventCallback;
import eventbus.EventCallback;
import eventbus.dispatch.AsyncEventBus;
import eventbus.dispatch.EventBus;
import eventbus.eventful.AsyncEventful;
import eventbus.eventful.Eventful;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class EventfulRegistrarTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(EventBusAutoConfiguration.class));

    @Test
    void bindsAsyncEventfulToAsyncBus() {
        runner.withPropertyValues("eventbus.mode=ASYNC")
                .withUserConfiguration(AsyncConfig.class)
                .run(ctx -> {
                    AsyncEventBus bus = ctx.getBean(AsyncEventBus.class);
                    Counter counter = ctx.getBean(Counter.class);

                    bus.emit("tick").join();

                    assertEquals(1, counter.ticks.get());
                });
    }

    @Test
    void failsWhenEventfulMeetsAsyncBus() {
        runner.withPropertyValues("eventbus.mode=ASYNC")
                .withUserConfiguration(SyncConfig.class)
                .run(ctx -> {
                    assertNotNull(ctx.getStartupFailure());
                    assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
                });
    }

    @Test
    void failsWhenAsyncEventfulMeetsBlockingBus() {
        runner.withUserConfiguration(AsyncConfig.class).run(ctx ->
                assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure()));
    }

    @Test
    void failsWhenEventfulDeclaresAsyncCallbackForBlockingBus() {
        runner.withUserConfiguration(MixedConfig.class).run(ctx -> {
            Throwable failure = ctx.getStartupFailure();
            assertInstanceOf(BeanCreationException.class, failure);
            assertInstanceOf(IllegalArgumentException.class, failure.getCause());
        });
    }

    @Test
    void unbindsOnContextClose() {
        AtomicReference<EventBus> bus = new AtomicReference<>();
        runner.withUserConfiguration(SyncConfig.class).run(ctx -> {
            bus.set(ctx.getBean(EventBus.class));
            assertFalse(bus.get().getCallbacks("tick").isEmpty());
        });
        assertTrue(bus.get().getCallbacks("tick").isEmpty());
    }

    static class SyncCounter extends Eventful {
        final AtomicInteger ticks = new AtomicInteger();

        SyncCounter() {
            listen("tick", (EventCallback) args -> ticks.incrementAndGet());
        }
    }

    static class Counter extends AsyncEventful {
        final AtomicInteger ticks = new AtomicInteger();

        Counter() {
            listen("tick", (AsyncEventCallback) args -> {
                ticks.incrementAndGet();
                return CompletableFuture.completedFuture(null);
            });
        }
    }

    static class Mixed extends Eventful {
        Mixed() {
            listen("tick", (AsyncEventCallback) args -> null);
        }
    }

    @Configuration
    static class SyncConfig {
        @Bean
        SyncCounter syncCounter() {
            return new SyncCounter();
        }
    }

    @Configuration
    static class AsyncConfig {
        @Bean
        Counter counter() {
            return new Counter();
        }
    }

    @Configuration
    static class MixedConfig {
        @Bean
        Mixed mixed() {
            return new Mixed();
        }
    }
}
