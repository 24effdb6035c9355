package eventbus.dispatch;

import eventbus.Callback;
import eventbus.EventCallback;
import eventbus.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Queues emissions and dispatches them on a dedicated loop thread backed by a worker pool.
 *
 * <p>{@link #emit} only enqueues and returns. The loop takes one emission at a time in FIFO
 * order and, group by group, submits every callback of the group to the pool and waits for
 * all of them before moving on. Failures are reported in completion order.
 *
 * <p>The bus starts {@link State#STOPPED}; emissions made while stopped are dropped. Use
 * {@link #start()}/{@link #shutdown()} or a try-with-resources block:
 *
 * <pre>{@code
 * try (ThreadedEventBus bus = ThreadedEventBus.builder().maxWorkers(4).build().open()) {
 *   bus.on("tick", args -> process(args[0]));
 *   bus.emit("tick", 1);
 *   bus.waitForIdle();
 * }
 * }</pre>
 *
 * <p>{@link #shutdown()} waits for the loop to drain, so it must not be called from a
 * callback running on this bus. An {@link Error} thrown by a callback terminates the loop
 * once its group has finished: the bus returns to {@link State#STOPPED}, queued emissions
 * are discarded, {@link #waitForIdle()} returns, and the loop thread's uncaught-exception
 * handler logs the error. The bus can be started again.
 */
public final class ThreadedEventBus extends AbstractEventBus implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ThreadedEventBus.class.getName());

  private static final Object SHUTDOWN = new Object();

  public enum State {
    STOPPED,
    RUNNING
  }

  private final int maxWorkers;
  private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
  private final DaemonThreadFactory loopThreads = new DaemonThreadFactory("eventbus-loop-");
  private final Object stateLock = new Object();
  private final Object idleLock = new Object();

  private volatile State state = State.STOPPED;
  private Thread loopThread;
  private volatile Thread retiredLoop;
  private long unfinished;

  private ThreadedEventBus(Builder builder) {
    super(builder);
    this.maxWorkers = builder.maxWorkers > 0 ? builder.maxWorkers : defaultMaxWorkers();
  }

  public static Builder builder() {
    return new Builder();
  }

  static int defaultMaxWorkers() {
    return Math.min(32, Runtime.getRuntime().availableProcessors() + 4);
  }

  /**
   * Starts the dispatch loop.
   *
   * @throws IllegalStateException if the bus is already running
   */
  public void start() {
    awaitRetiredLoop();
    synchronized (stateLock) {
      if (state == State.RUNNING) {
        throw new IllegalStateException("ThreadedEventBus is already running");
      }
      startLoop();
    }
  }

  private void startLoop() {
    discardQueued();
    state = State.RUNNING;
    loopThread = loopThreads.newThread(this::dispatchLoop);
    loopThread.start();
  }

  /**
   * Stops accepting emissions and waits until everything queued before this call has been
   * dispatched and the worker pool has been shut down.
   *
   * @throws IllegalStateException if the bus is already stopped
   */
  public void shutdown() {
    Thread loop;
    synchronized (stateLock) {
      if (state == State.STOPPED) {
        throw new IllegalStateException("ThreadedEventBus is already shut down");
      }
      state = State.STOPPED;
      enqueue(SHUTDOWN);
      loop = loopThread;
      loopThread = null;
      retiredLoop = loop;
    }
    try {
      loop.join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Interrupted while waiting for " + loop.getName() + " to finish");
    }
  }

  /**
   * Starts the bus if it is stopped.
   *
   * @return this bus
   */
  public ThreadedEventBus open() {
    awaitRetiredLoop();
    synchronized (stateLock) {
      if (state == State.STOPPED) {
        startLoop();
      }
    }
    return this;
  }

  /**
   * Shuts the bus down if it is running.
   */
  @Override
  public void close() {
    if (isRunning()) {
      shutdown();
    }
  }

  public boolean isRunning() {
    return state == State.RUNNING;
  }

  public State state() {
    return state;
  }

  /**
   * Returns the number of queued items not yet taken by the dispatch loop.
   */
  public int queueDepth() {
    return queue.size();
  }

  public int maxWorkers() {
    return maxWorkers;
  }

  /**
   * Enqueues the emission and returns immediately. Dropped if the bus is not running.
   */
  @Override
  public void emit(String event, Object... args) {
    Objects.requireNonNull(event, "event");
    Object[] values = copyArgs(args);
    synchronized (stateLock) {
      if (state != State.RUNNING) {
        metrics.incrementDropped();
        logger.log(Level.FINE, "Dropped ''{0}'': bus is not running", event);
        return;
      }
      enqueue(new Emission(event, values));
    }
    metrics.incrementEmitted();
    metrics.recordQueueDepth(queue.size());
  }

  /**
   * Blocks until every item enqueued so far has been fully dispatched.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void waitForIdle() throws InterruptedException {
    synchronized (idleLock) {
      while (unfinished > 0) {
        idleLock.wait();
      }
    }
  }

  private void enqueue(Object item) {
    synchronized (idleLock) {
      unfinished++;
    }
    queue.add(item);
  }

  // A loop left over from an interrupted shutdown may still be draining the queue.
  private void awaitRetiredLoop() {
    Thread previous = retiredLoop;
    if (previous == null || previous == Thread.currentThread()) {
      return;
    }
    try {
      previous.join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for " + previous.getName() + " to finish", e);
    }
  }

  // Caller holds stateLock and no loop is consuming the queue.
  private int discardQueued() {
    int discarded = queue.size();
    queue.clear();
    synchronized (idleLock) {
      unfinished = 0;
      idleLock.notifyAll();
    }
    return discarded;
  }

  // The loop died without taking the shutdown sentinel.
  private void abandon() {
    synchronized (stateLock) {
      if (loopThread == Thread.currentThread()) {
        state = State.STOPPED;
        loopThread = null;
        retiredLoop = Thread.currentThread();
      }
      int discarded = discardQueued();
      logger.log(Level.SEVERE, "Dispatch loop " + Thread.currentThread().getName()
          + " terminated; bus stopped and " + discarded + " queued items discarded");
    }
  }

  private void taskDone() {
    synchronized (idleLock) {
      if (--unfinished == 0) {
        idleLock.notifyAll();
      }
    }
  }

  private void dispatchLoop() {
    ExecutorService workers = Executors.newFixedThreadPool(
        maxWorkers, new DaemonThreadFactory("eventbus-worker-"));
    boolean shutdownTaken = false;
    try {
      while (true) {
        Object item = queue.take();
        if (item == SHUTDOWN) {
          shutdownTaken = true;
          taskDone();
          return;
        }
        metrics.recordQueueDepth(queue.size());
        Emission emission = (Emission) item;
        dispatch(workers, ANY_EVENT, metaArgs(emission.event(), emission.args()));
        dispatch(workers, emission.event(), emission.args());
        // On abnormal exit abandon() settles the count once the bus is stopped.
        taskDone();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Dispatch loop interrupted");
    } finally {
      workers.shutdown();
      if (!shutdownTaken) {
        abandon();
      }
    }
  }

  /**
   * Runs the groups of one event. Every task of a group is collected before the group is
   * left, even when the error handler throws or a task fails fatally.
   */
  private void dispatch(ExecutorService workers, String event, Object[] args) throws InterruptedException {
    List<List<Callback>> groups = getCallbacks(event);
    if (groups.isEmpty()) {
      return;
    }
    List<Object> argList = argList(args);
    for (List<Callback> group : groups) {
      CompletionService<Void> completion = new ExecutorCompletionService<>(workers);
      for (Callback callback : group) {
        completion.submit(task((EventCallback) callback, args));
      }
      Error fatal = null;
      for (int i = 0; i < group.size(); i++) {
        Future<Void> done = completion.take();
        try {
          done.get();
          metrics.incrementListenerSuccess();
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          if (cause instanceof Error error) {
            if (fatal == null) {
              fatal = error;
            } else if (fatal != error) {
              fatal.addSuppressed(error);
            }
            continue;
          }
          reportSafely(event, cause instanceof Exception exception ? exception : e, argList);
        }
      }
      if (fatal != null) {
        throw fatal;
      }
    }
  }

  private void reportSafely(String event, Exception error, List<Object> argList) {
    try {
      reportFailure(event, error, argList);
    } catch (RuntimeException e) {
      e.addSuppressed(error);
      logger.log(Level.SEVERE, "Error handler failed while dispatching '" + event + "'", e);
    }
  }

  private Callable<Void> task(EventCallback callback, Object[] args) {
    return () -> {
      long start = System.nanoTime();
      try {
        callback.call(args);
        return null;
      } finally {
        metrics.recordListenerDurationMs(elapsedMs(start));
      }
    };
  }

  private record Emission(String event, Object[] args) {}

  public static final class Builder extends AbstractBuilder<Builder> {
    private int maxWorkers;

    private Builder() {}

    /**
     * Sets the size of the worker pool.
     *
     * <p>Optional. Defaults to {@code min(32, availableProcessors + 4)} when unset or 0.
     *
     * @param maxWorkers number of worker threads
     * @return this builder
     */
    public Builder maxWorkers(int maxWorkers) {
      this.maxWorkers = maxWorkers;
      return this;
    }

    public ThreadedEventBus build() {
      if (maxWorkers < 0) {
        throw new IllegalArgumentException("maxWorkers must be >= 0, got " + maxWorkers);
      }
      return new ThreadedEventBus(this);
    }
  }
}
