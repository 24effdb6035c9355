package eventbus.spring.boot;

import eventbus.dispatch.BaseEventBus;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the auto-configured event bus.
 *
 * @see EventBusAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventbus")
public class EventBusProperties {

    /**
     * Dispatch engine: blocking, async, or threaded.
     */
    private Mode mode = Mode.BLOCKING;

    /**
     * Priority assigned to callbacks registered without one.
     */
    private int defaultPriority = BaseEventBus.DEFAULT_PRIORITY;

    private final Threaded threaded = new Threaded();
    private final Metrics metrics = new Metrics();

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public int getDefaultPriority() {
        return defaultPriority;
    }

    public void setDefaultPriority(int defaultPriority) {
        this.defaultPriority = defaultPriority;
    }

    public Threaded getThreaded() {
        return threaded;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum Mode {
        BLOCKING,
        ASYNC,
        THREADED
    }

    public static class Threaded {
        /**
         * Worker pool size; 0 selects min(32, processors + 4).
         */
        private int maxWorkers;

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventbus";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
