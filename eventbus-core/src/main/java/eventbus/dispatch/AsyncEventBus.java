package eventbus.dispatch;

import eventbus.AsyncEventCallback;
import eventbus.AsyncEventEmitter;
import eventbus.Callback;
import eventbus.EventCallback;
import eventbus.eventful.AsyncEventful;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Fans each priority group out and joins it before the next group starts.
 *
 * <p>Every callback of a group is invoked on the thread driving the dispatch. Stages
 * returned by {@link AsyncEventCallback}s are then awaited together; a failing stage
 * never cancels its siblings. Once the whole group has settled, each captured failure is
 * reported to the error handler and the next group runs. Only one group per dispatch is
 * in flight at any time.
 *
 * <p>{@link #emit} starts the {@link #ANY_EVENT} dispatch and the named dispatch one after
 * the other and returns a future completing when both have finished. A fatal
 * {@link Error} completes that future exceptionally.
 */
public final class AsyncEventBus extends BaseEventBus implements AsyncEventEmitter {

  private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

  private final Executor continuationExecutor;

  private AsyncEventBus(Builder builder) {
    super(builder);
    this.continuationExecutor = builder.continuationExecutor;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers an asynchronous callback with the default priority and returns it.
   *
   * @param event    the event name
   * @param callback the callback
   * @return {@code callback}
   */
  public AsyncEventCallback onAsync(String event, AsyncEventCallback callback) {
    addCallback(event, callback);
    return callback;
  }

  /**
   * Registers an asynchronous callback with a priority and returns it.
   *
   * @param event    the event name
   * @param priority the priority; lower values are invoked first
   * @param callback the callback
   * @return {@code callback}
   */
  public AsyncEventCallback onAsync(String event, int priority, AsyncEventCallback callback) {
    addCallback(event, callback, priority);
    return callback;
  }

  public void bindEventful(AsyncEventful eventful) {
    bind(eventful, this);
  }

  public void unbindEventful(AsyncEventful eventful) {
    unbind(eventful, this);
  }

  @Override
  public CompletableFuture<Void> emit(String event, Object... args) {
    Objects.requireNonNull(event, "event");
    Object[] values = copyArgs(args);
    metrics.incrementEmitted();
    CompletableFuture<Void> meta = dispatch(ANY_EVENT, metaArgs(event, values));
    CompletableFuture<Void> named = dispatch(event, values);
    return CompletableFuture.allOf(meta, named);
  }

  private CompletableFuture<Void> dispatch(String event, Object[] args) {
    List<List<Callback>> groups = getCallbacks(event);
    if (groups.isEmpty()) {
      return DONE;
    }
    try {
      return dispatchFrom(new Dispatch(event, groups, args, argList(args)), 0);
    } catch (RuntimeException | Error e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private CompletableFuture<Void> dispatchFrom(Dispatch dispatch, int first) {
    for (int i = first; i < dispatch.groups().size(); i++) {
      GroupRun run = start(dispatch, dispatch.groups().get(i));
      CompletableFuture<Void> settled = run.settled();
      if (settled.isDone()) {
        // Already settled; handled inline.
        run.collectPending();
      } else {
        int next = i + 1;
        Function<Void, CompletableFuture<Void>> resume = ignored -> {
          run.collectPending();
          report(dispatch, run);
          return dispatchFrom(dispatch, next);
        };
        return continuationExecutor == null
            ? settled.thenCompose(resume)
            : settled.thenComposeAsync(resume, continuationExecutor);
      }
      report(dispatch, run);
    }
    return DONE;
  }

  private GroupRun start(Dispatch dispatch, List<Callback> group) {
    GroupRun run = new GroupRun();
    for (Callback callback : group) {
      long start = System.nanoTime();
      try {
        if (callback instanceof AsyncEventCallback deferred) {
          CompletionStage<?> stage = deferred.call(dispatch.args());
          if (stage == null) {
            metrics.incrementListenerSuccess();
          } else {
            run.pending.add(outcomeOf(stage));
          }
        } else {
          ((EventCallback) callback).call(dispatch.args());
          metrics.incrementListenerSuccess();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new DispatchInterruptedException(dispatch.event(), e);
      } catch (Exception e) {
        run.errors.add(e);
      } finally {
        metrics.recordListenerDurationMs(elapsedMs(start));
      }
    }
    return run;
  }

  private void report(Dispatch dispatch, GroupRun run) {
    for (Exception error : run.errors) {
      reportFailure(dispatch.event(), error, dispatch.argList());
    }
  }

  /** Completes normally with the stage's failure, or {@code null} on success. */
  private static CompletableFuture<Throwable> outcomeOf(CompletionStage<?> stage) {
    CompletableFuture<Throwable> outcome = new CompletableFuture<>();
    stage.whenComplete((value, failure) -> outcome.complete(failure));
    return outcome;
  }

  private static Throwable unwrap(Throwable failure) {
    Throwable cause = failure;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }

  private record Dispatch(String event, List<List<Callback>> groups, Object[] args, List<Object> argList) {}

  private final class GroupRun {
    final List<Exception> errors = new ArrayList<>();
    final List<CompletableFuture<Throwable>> pending = new ArrayList<>();

    CompletableFuture<Void> settled() {
      return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]));
    }

    void collectPending() {
      for (CompletableFuture<Throwable> outcome : pending) {
        Throwable failure = outcome.join();
        if (failure == null) {
          metrics.incrementListenerSuccess();
          continue;
        }
        Throwable cause = unwrap(failure);
        if (cause instanceof Error error) {
          throw error;
        }
        errors.add(cause instanceof Exception exception ? exception : new CompletionException(cause));
      }
    }
  }

  public static final class Builder extends AbstractBuilder<Builder> {
    private Executor continuationExecutor;

    private Builder() {}

    /**
     * Sets the executor that resumes a dispatch after a group's stages have settled.
     *
     * <p>Optional. Defaults to the thread that completed the last stage.
     *
     * @param continuationExecutor the executor
     * @return this builder
     */
    public Builder continuationExecutor(Executor continuationExecutor) {
      this.continuationExecutor = continuationExecutor;
      return this;
    }

    public AsyncEventBus build() {
      return new AsyncEventBus(this);
    }
  }
}
