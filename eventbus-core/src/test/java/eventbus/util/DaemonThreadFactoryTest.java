package eventbus.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DaemonThreadFactoryTest {

  @Test
  void createsNumberedDaemonThreads() {
    DaemonThreadFactory factory = new DaemonThreadFactory("eventbus-test-");

    Thread first = factory.newThread(() -> {});
    Thread second = factory.newThread(() -> {});

    assertTrue(first.isDaemon());
    assertEquals("eventbus-test-1", first.getName());
    assertEquals("eventbus-test-2", second.getName());
    assertNotNull(first.getUncaughtExceptionHandler());
    assertEquals("eventbus-test-", factory.prefix());
  }

  @Test
  void rejectsNullPrefix() {
    assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
  }
}
