package eventbus.dispatch;

import eventbus.AsyncEventCallback;
import eventbus.spi.MetricsExporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ThreadedEventBusTest {

  private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
  private final List<String> failures = Collections.synchronizedList(new ArrayList<>());
  private final ThreadedEventBus bus = ThreadedEventBus.builder()
      .maxWorkers(4)
      .errorHandler((event, error, args) -> failures.add(event + ":" + error.getMessage()))
      .build();

  @AfterEach
  void tearDown() {
    bus.close();
  }

  // ── Lifecycle ───────────────────────────────────────────────────

  @Test
  void startsStopped() {
    assertEquals(ThreadedEventBus.State.STOPPED, bus.state());
    assertFalse(bus.isRunning());
  }

  @Test
  void doubleStartThrows() {
    bus.start();

    assertThrows(IllegalStateException.class, bus::start);
    assertTrue(bus.isRunning());
  }

  @Test
  void shutdownWhenStoppedThrows() {
    assertThrows(IllegalStateException.class, bus::shutdown);

    bus.start();
    bus.shutdown();

    assertThrows(IllegalStateException.class, bus::shutdown);
  }

  @Test
  void canBeRestartedAfterShutdown() throws Exception {
    bus.on("greet", args -> calls.add("greet"));
    bus.start();
    bus.shutdown();
    bus.start();

    bus.emit("greet");
    bus.waitForIdle();

    assertEquals(List.of("greet"), calls);
  }

  @Test
  void openAndCloseScopeTheLoop() throws Exception {
    AtomicInteger seen = new AtomicInteger();
    ThreadedEventBus scoped = ThreadedEventBus.builder().build();
    scoped.on("greet", args -> seen.incrementAndGet());

    try (ThreadedEventBus running = scoped.open()) {
      assertSame(scoped, running);
      assertTrue(running.isRunning());
      assertSame(scoped, running.open());
      running.emit("greet");
    }

    assertFalse(scoped.isRunning());
    assertEquals(1, seen.get());
    assertDoesNotThrow(scoped::close);
  }

  @Test
  void rejectsNegativeMaxWorkers() {
    assertThrows(IllegalArgumentException.class,
        () -> ThreadedEventBus.builder().maxWorkers(-1).build());
  }

  @Test
  void defaultsMaxWorkersFromProcessorCount() {
    int expected = Math.min(32, Runtime.getRuntime().availableProcessors() + 4);

    assertEquals(expected, ThreadedEventBus.builder().build().maxWorkers());
    assertEquals(expected, ThreadedEventBus.builder().maxWorkers(0).build().maxWorkers());
  }

  // ── Dispatch ────────────────────────────────────────────────────

  @Test
  void emitWhileStoppedIsDropped() throws Exception {
    AtomicInteger dropped = new AtomicInteger();
    ThreadedEventBus counted = ThreadedEventBus.builder().metrics(new CountingMetrics(dropped)).build();
    counted.on("greet", args -> calls.add("greet"));

    counted.emit("greet");
    counted.start();
    try {
      counted.waitForIdle();
    } finally {
      counted.shutdown();
    }

    assertTrue(calls.isEmpty());
    assertEquals(1, dropped.get());
  }

  @Test
  void dispatchesEmissionsInFifoOrder() throws Exception {
    bus.on("n", args -> calls.add(String.valueOf(args[0])));
    bus.start();

    for (int i = 0; i < 50; i++) {
      bus.emit("n", i);
    }
    bus.waitForIdle();

    List<String> expected = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      expected.add(String.valueOf(i));
    }
    assertEquals(expected, calls);
  }

  @Test
  void groupRunsInParallelAndNextGroupWaits() throws Exception {
    CyclicBarrier barrier = new CyclicBarrier(3);
    for (int i = 0; i < 3; i++) {
      bus.on("greet", 1, args -> {
        barrier.await(5, TimeUnit.SECONDS);
        calls.add("first");
      });
    }
    bus.on("greet", 2, args -> calls.add("second"));
    bus.start();

    bus.emit("greet");
    bus.waitForIdle();

    assertEquals(List.of("first", "first", "first", "second"), calls);
    assertTrue(failures.isEmpty());
  }

  @Test
  void callbacksRunOnWorkerThreads() throws Exception {
    Set<String> threads = ConcurrentHashMap.newKeySet();
    bus.on("greet", args -> threads.add(Thread.currentThread().getName()));
    bus.start();

    bus.emit("greet");
    bus.waitForIdle();

    assertEquals(1, threads.size());
    assertTrue(threads.iterator().next().startsWith("eventbus-worker-"));
  }

  @Test
  void metaEventPrecedesNamedEvent() throws Exception {
    bus.on(BaseEventBus.ANY_EVENT, args -> calls.add("meta:" + args[0] + args[1]));
    bus.on("greet", args -> calls.add("named"));
    bus.start();

    bus.emit("greet", "x");
    bus.waitForIdle();

    assertEquals(List.of("meta:greet[x]", "named"), calls);
  }

  @Test
  void failuresAreReportedAndDispatchContinues() throws Exception {
    bus.on("greet", 1, args -> {
      throw new IllegalStateException("boom");
    });
    bus.on("greet", 1, args -> calls.add("sibling"));
    bus.on("greet", 2, args -> calls.add("later"));
    bus.start();

    bus.emit("greet");
    bus.emit("greet");
    bus.waitForIdle();

    assertEquals(List.of("greet:boom", "greet:boom"), failures);
    assertEquals(List.of("sibling", "later", "sibling", "later"), calls);
  }

  @Test
  void throwingErrorHandlerStillDrainsGroupBeforeNextEmission() throws Exception {
    ThreadedEventBus strict = ThreadedEventBus.builder()
        .maxWorkers(4)
        .errorHandler((event, error, args) -> {
          throw new IllegalStateException("handler down");
        })
        .build();
    strict.on("a", 1, args -> {
      throw new IllegalArgumentException("fast");
    });
    strict.on("a", 1, args -> {
      Thread.sleep(300);
      calls.add("a-slow-done");
    });
    strict.on("b", args -> calls.add("b"));
    strict.start();
    try {
      strict.emit("a");
      strict.emit("b");
      strict.waitForIdle();

      assertEquals(List.of("a-slow-done", "b"), calls);
      assertTrue(strict.isRunning());
    } finally {
      strict.shutdown();
    }
  }

  @Test
  void fatalErrorStopsBusAndReleasesWaiters() throws Exception {
    bus.on("fatal", args -> {
      throw new StackOverflowError("deep");
    });
    bus.on("after", args -> calls.add("after"));
    bus.start();

    bus.emit("fatal");
    bus.emit("after");
    assertTimeoutPreemptively(Duration.ofSeconds(5), bus::waitForIdle);

    assertEquals(ThreadedEventBus.State.STOPPED, bus.state());
    assertEquals(0, bus.queueDepth());
    assertTrue(calls.isEmpty());
    assertThrows(IllegalStateException.class, bus::shutdown);
  }

  @Test
  void restartsAfterFatalError() throws Exception {
    bus.on("fatal", args -> {
      throw new StackOverflowError("deep");
    });
    bus.on("after", args -> calls.add("after"));
    bus.start();
    bus.emit("fatal");
    assertTimeoutPreemptively(Duration.ofSeconds(5), bus::waitForIdle);

    bus.start();
    bus.emit("after");
    bus.waitForIdle();

    assertTrue(bus.isRunning());
    assertEquals(List.of("after"), calls);
  }

  @Test
  void shutdownDrainsQueuedEmissions() {
    CountDownLatch release = new CountDownLatch(1);
    bus.on("slow", args -> release.await(5, TimeUnit.SECONDS));
    bus.on("fast", args -> calls.add("fast"));
    bus.start();

    bus.emit("slow");
    bus.emit("fast");
    release.countDown();
    bus.shutdown();

    assertEquals(List.of("fast"), calls);
    assertEquals(0, bus.queueDepth());
  }

  @Test
  void rejectsAsyncCallback() {
    AsyncEventCallback deferred = args -> CompletableFuture.completedFuture(null);

    assertThrows(IllegalArgumentException.class, () -> bus.addCallback("greet", deferred, 1));
    assertTrue(bus.getCallbacks("greet").isEmpty());
  }

  @Test
  void waitForIdleReturnsImmediatelyWhenNothingQueued() {
    assertTimeoutPreemptively(Duration.ofSeconds(5), bus::waitForIdle);
  }

  private static final class CountingMetrics implements MetricsExporter {
    private final AtomicInteger dropped;

    CountingMetrics(AtomicInteger dropped) {
      this.dropped = dropped;
    }

    @Override
    public void incrementEmitted() {
    }

    @Override
    public void incrementDropped() {
      dropped.incrementAndGet();
    }

    @Override
    public void incrementListenerSuccess() {
    }

    @Override
    public void incrementListenerFailure() {
    }

    @Override
    public void recordQueueDepth(int depth) {
    }
  }
}
