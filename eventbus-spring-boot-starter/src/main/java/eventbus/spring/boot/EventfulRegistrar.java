package eventbus.spring.boot;

import eventbus.dispatch.AbstractEventBus;
import eventbus.dispatch.AsyncEventBus;
import eventbus.dispatch.BaseEventBus;
import eventbus.eventful.AsyncEventful;
import eventbus.eventful.Eventful;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Binds every {@link Eventful} and {@link AsyncEventful} bean to the context's bus, and
 * unbinds them when the context closes.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 * {@code Eventful} beans need a blocking or threaded bus, {@code AsyncEventful} beans an
 * {@link AsyncEventBus}; a mismatch fails startup.
 */
public class EventfulRegistrar implements SmartInitializingSingleton, DisposableBean {

    private final ListableBeanFactory beanFactory;
    private final BaseEventBus eventBus;
    private final List<Runnable> unbinds = new ArrayList<>();

    public EventfulRegistrar(ListableBeanFactory beanFactory, BaseEventBus eventBus) {
        this.beanFactory = beanFactory;
        this.eventBus = eventBus;
    }

    @Override
    public void afterSingletonsInstantiated() {
        for (Map.Entry<String, Eventful> entry : beanFactory.getBeansOfType(Eventful.class).entrySet()) {
            String beanName = entry.getKey();
            Eventful eventful = entry.getValue();
            if (!(eventBus instanceof AbstractEventBus bus)) {
                throw mismatch(beanName, Eventful.class, "a blocking or threaded bus");
            }
            bind(beanName, () -> bus.bindEventful(eventful));
            unbinds.add(() -> bus.unbindEventful(eventful));
        }
        for (Map.Entry<String, AsyncEventful> entry : beanFactory.getBeansOfType(AsyncEventful.class).entrySet()) {
            String beanName = entry.getKey();
            AsyncEventful eventful = entry.getValue();
            if (!(eventBus instanceof AsyncEventBus bus)) {
                throw mismatch(beanName, AsyncEventful.class, "an asynchronous bus");
            }
            bind(beanName, () -> bus.bindEventful(eventful));
            unbinds.add(() -> bus.unbindEventful(eventful));
        }
    }

    @Override
    public void destroy() {
        for (Runnable unbind : unbinds) {
            unbind.run();
        }
        unbinds.clear();
    }

    private void bind(String beanName, Runnable binding) {
        try {
            binding.run();
        } catch (IllegalArgumentException e) {
            throw new BeanCreationException(beanName,
                    "Failed to bind eventful bean to " + eventBus.getClass().getSimpleName(), e);
        }
    }

    private BeanCreationException mismatch(String beanName, Class<?> type, String required) {
        return new BeanCreationException(beanName,
                type.getSimpleName() + " beans require " + required + ", but the configured bus is "
                        + eventBus.getClass().getSimpleName() + " (set eventbus.mode)");
    }
}
