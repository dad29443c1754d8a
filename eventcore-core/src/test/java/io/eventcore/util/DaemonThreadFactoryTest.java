package io.eventcore.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DaemonThreadFactoryTest {

  @Test
  void createsNumberedDaemonThreads() {
    DaemonThreadFactory factory = new DaemonThreadFactory("eventcore-test-");

    Thread first = factory.newThread(() -> {});
    Thread second = factory.newThread(() -> {});

    assertTrue(first.isDaemon());
    assertEquals("eventcore-test-1", first.getName());
    assertEquals("eventcore-test-2", second.getName());
  }

  @Test
  void installsLoggingUncaughtHandler() throws Exception {
    Thread thread = new DaemonThreadFactory("eventcore-test-").newThread(() -> {
      throw new IllegalStateException("escaped");
    });

    assertNotSame(thread.getThreadGroup(), thread.getUncaughtExceptionHandler());
    thread.start();
    thread.join(2_000);
    assertFalse(thread.isAlive());
  }

  @Test
  void poolThreadsCarryPrefix() throws Exception {
    ExecutorService pool = Executors.newSingleThreadExecutor(new DaemonThreadFactory("eventcore-pool-"));
    try {
      String name = pool.submit(() -> Thread.currentThread().getName()).get(2, TimeUnit.SECONDS);
      assertEquals("eventcore-pool-1", name);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void rejectsNullPrefix() {
    assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
  }
}
