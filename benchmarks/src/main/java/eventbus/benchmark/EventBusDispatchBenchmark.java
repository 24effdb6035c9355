package eventbus.benchmark;

import eventbus.dispatch.AsyncEventBus;
import eventbus.dispatch.EventBus;
import eventbus.dispatch.ThreadedEventBus;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Measures emit-to-completion latency of the three buses for a fan-out of callbacks spread
 * over several priority groups.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar EventBusDispatchBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class EventBusDispatchBenchmark {

  @Param({"1", "10", "100"})
  private int callbacks;

  @Param({"1", "4"})
  private int groups;

  private EventBus blocking;
  private AsyncEventBus async;
  private ThreadedEventBus threaded;
  private final LongAdder invocations = new LongAdder();

  @Setup(Level.Trial)
  public void setup() {
    blocking = EventBus.builder().build();
    async = AsyncEventBus.builder().build();
    threaded = ThreadedEventBus.builder().maxWorkers(4).build().open();

    for (int i = 0; i < callbacks; i++) {
      int priority = i % groups;
      blocking.on("bench", priority, args -> invocations.increment());
      threaded.on("bench", priority, args -> invocations.increment());
      async.onAsync("bench", priority, args -> {
        invocations.increment();
        return CompletableFuture.completedFuture(null);
      });
    }
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    threaded.close();
  }

  @Benchmark
  public long blockingEmit() {
    blocking.emit("bench", "payload");
    return invocations.sum();
  }

  @Benchmark
  public void asyncEmit() {
    async.emit("bench", "payload").join();
  }

  @Benchmark
  public void threadedEmitAndWait() throws InterruptedException {
    threaded.emit("bench", "payload");
    threaded.waitForIdle();
  }
}
