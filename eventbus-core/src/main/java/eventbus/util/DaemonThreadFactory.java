package eventbus.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory for bus-owned threads: daemon, named {@code <prefix>1},
 * {@code <prefix>2}, ..., with uncaught failures logged.
 *
 * <p>Daemon threads keep a bus that was never shut down from blocking JVM exit.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private static final Thread.UncaughtExceptionHandler LOG_UNCAUGHT = (thread, error) ->
      logger.log(Level.SEVERE, "Uncaught failure on thread " + thread.getName(), error);

  private final String prefix;
  private final AtomicInteger counter = new AtomicInteger(1);

  public DaemonThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(LOG_UNCAUGHT);
    return thread;
  }

  /**
   * Returns the prefix applied to thread names.
   */
  public String prefix() {
    return prefix;
  }
}
