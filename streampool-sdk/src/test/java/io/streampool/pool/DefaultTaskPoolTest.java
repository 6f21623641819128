package io.streampool.pool;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

import io.streampool.internal.logging.LoggerTag;
import io.streampool.internal.pool.ThreadPoolBackend;
import io.streampool.testUtils.LoggerUtils;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;
import org.slf4j.MDC;

public class DefaultTaskPoolTest {

  @Rule public final Timeout globalTimeout = Timeout.seconds(30);

  private LoggerUtils.SilenceLoggers silence;

  @Before
  public void setUp() {
    // dropped items are logged as warnings
    silence = LoggerUtils.silenceLoggers(DefaultTaskPool.class);
  }

  @After
  public void tearDown() {
    silence.close();
  }

  @Test
  public void everyPushedItemRunsOnceBeforeCleanupReturns() {
    for (int itemCount : new int[] {0, 1, 100}) {
      TaskPool pool = TaskPools.newTaskPool();
      pool.prepare();
      ConcurrentHashMap<Integer, AtomicInteger> runs = new ConcurrentHashMap<>();
      for (int i = 0; i < itemCount; i++) {
        runs.put(i, new AtomicInteger());
        assertTrue(pool.push(AtomicInteger::incrementAndGet, runs.get(i)).isPresent());
      }
      pool.cleanup();

      for (int i = 0; i < itemCount; i++) {
        assertEquals("item " + i, 1, runs.get(i).get());
      }
    }
  }

  @Test
  public void boundedPoolRunsAllItemsOnAtMostMaxThreads() {
    DefaultTaskPool pool = (DefaultTaskPool) TaskPools.newTaskPool(2, false);
    pool.prepare();
    ThreadPoolBackend backend = pool.getBackend();
    AtomicInteger counter = new AtomicInteger();
    for (int i = 0; i < 5; i++) {
      pool.push(
          c -> {
            Thread.sleep(10);
            c.incrementAndGet();
          },
          counter);
    }
    pool.cleanup();

    assertEquals(5, counter.get());
    assertTrue(backend.getLargestPoolSize() <= 2);
    assertTrue(backend.isTerminated());
  }

  @Test
  public void exclusivePoolStartsAllThreadsOnPrepare() {
    DefaultTaskPool pool = (DefaultTaskPool) TaskPools.newTaskPool(3, true);
    assertNull(pool.getBackend());
    pool.prepare();
    try {
      assertEquals(3, pool.getBackend().getPoolSize());
    } finally {
      pool.cleanup();
    }
  }

  @Test
  public void pushBeforePrepareIsDropped() {
    TaskPool pool = TaskPools.newTaskPool();
    WorkItem item = WorkItem.of(() -> fail("dropped item must not run"));

    assertFalse(pool.push(item).isPresent());
    assertFalse(item.isConsumed());
  }

  @Test
  public void pushAfterCleanupIsDropped() {
    DefaultTaskPool pool = (DefaultTaskPool) TaskPools.newTaskPool();
    pool.prepare();
    pool.cleanup();
    assertFalse(pool.isPrepared());

    WorkItem item = WorkItem.of(() -> fail("dropped item must not run"));
    assertFalse(pool.push(item).isPresent());
    assertFalse(item.isConsumed());
  }

  @Test
  public void cleanupIsIdempotent() {
    TaskPool pool = TaskPools.newTaskPool();
    pool.cleanup();
    pool.prepare();
    pool.cleanup();
    pool.cleanup();

    // the pool can be prepared again after cleanup
    pool.prepare();
    AtomicInteger runs = new AtomicInteger();
    pool.push(AtomicInteger::incrementAndGet, runs);
    pool.cleanup();
    assertEquals(1, runs.get());
  }

  @Test
  public void concurrentCleanupsWaitForDrain() throws InterruptedException {
    TaskPool pool = TaskPools.newTaskPool();
    pool.prepare();
    CountDownLatch running = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger finished = new AtomicInteger();
    pool.push(
        WorkItem.of(
            () -> {
              running.countDown();
              try {
                release.await();
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              finished.incrementAndGet();
            }));
    assertTrue(running.await(10, TimeUnit.SECONDS));

    AtomicInteger finishedSeenByCleanup = new AtomicInteger(-1);
    Thread first = new Thread(() -> cleanupAndRecord(pool, finished, finishedSeenByCleanup));
    AtomicInteger finishedSeenBySecond = new AtomicInteger(-1);
    Thread second = new Thread(() -> cleanupAndRecord(pool, finished, finishedSeenBySecond));
    first.start();
    second.start();
    Thread.sleep(100);
    assertTrue(first.isAlive());
    assertTrue(second.isAlive());

    release.countDown();
    first.join();
    second.join();
    assertEquals(1, finishedSeenByCleanup.get());
    assertEquals(1, finishedSeenBySecond.get());
  }

  @Test
  public void pushFromDrainingItemIsDropped() throws InterruptedException {
    TaskPool pool = TaskPools.newTaskPool();
    pool.prepare();
    CountDownLatch running = new CountDownLatch(1);
    CountDownLatch cleanupStarted = new CountDownLatch(1);
    AtomicReference<Optional<TaskHandle>> nestedHandle = new AtomicReference<>();
    pool.push(
        WorkItem.of(
            c -> {
              running.countDown();
              cleanupStarted.await();
              // give cleanup() time to detach the backend
              Thread.sleep(100);
              nestedHandle.set(pool.push(WorkItem.of(() -> {})));
            },
            null));
    assertTrue(running.await(10, TimeUnit.SECONDS));
    cleanupStarted.countDown();
    pool.cleanup();

    assertFalse(nestedHandle.get().isPresent());
  }

  @Test
  public void prepareAgainReplacesBackend() {
    DefaultTaskPool pool = (DefaultTaskPool) TaskPools.newTaskPool();
    pool.prepare();
    ThreadPoolBackend first = pool.getBackend();
    pool.prepare();
    ThreadPoolBackend second = pool.getBackend();

    assertNotSame(first, second);
    assertTrue(first.isShutdown());
    assertTrue(pool.isPrepared());
    pool.cleanup();
    assertTrue(second.isTerminated());
  }

  @Test
  public void cleanupWaitsForItemsOfReplacedBackend() throws InterruptedException {
    DefaultTaskPool pool = (DefaultTaskPool) TaskPools.newTaskPool();
    pool.prepare();
    ThreadPoolBackend replaced = pool.getBackend();
    CountDownLatch running = new CountDownLatch(1);
    AtomicInteger finished = new AtomicInteger();
    pool.push(
        WorkItem.of(
            c -> {
              running.countDown();
              Thread.sleep(500);
              finished.incrementAndGet();
            },
            null));
    assertTrue(running.await(10, TimeUnit.SECONDS));
    pool.prepare();
    pool.cleanup();

    assertEquals(1, finished.get());
    assertTrue(replaced.isTerminated());
    assertFalse(pool.isPrepared());
  }

  @Test
  public void failingItemIsReportedAndPoolKeepsRunning() {
    Thread.UncaughtExceptionHandler handler = mock(Thread.UncaughtExceptionHandler.class);
    TaskPool pool =
        TaskPools.newTaskPool(
            TaskPoolOptions.newBuilder()
                .setMaxThreads(1)
                .setUncaughtExceptionHandler(handler)
                .validateAndBuildWithDefaults());
    pool.prepare();
    IllegalStateException failure = new IllegalStateException("simulated");
    pool.push(
        WorkItem.of(
            () -> {
              throw failure;
            }));
    AtomicInteger runs = new AtomicInteger();
    pool.push(AtomicInteger::incrementAndGet, runs);
    pool.cleanup();

    verify(handler, timeout(10_000)).uncaughtException(any(Thread.class), same(failure));
    assertEquals(1, runs.get());
  }

  @Test
  public void itemRunsWithPoolAndTaskInMdc() {
    TaskPool pool =
        TaskPools.newTaskPool(
            TaskPoolOptions.newBuilder().setName("mdc-pool").validateAndBuildWithDefaults());
    pool.prepare();
    AtomicReference<String> poolTag = new AtomicReference<>();
    AtomicReference<String> taskTag = new AtomicReference<>();
    Optional<TaskHandle> handle =
        pool.push(
            WorkItem.of(
                () -> {
                  poolTag.set(MDC.get(LoggerTag.TASK_POOL));
                  taskTag.set(MDC.get(LoggerTag.TASK_ID));
                }));
    pool.cleanup();

    assertEquals("mdc-pool", poolTag.get());
    assertEquals(String.valueOf(handle.get().getId()), taskTag.get());
  }

  @Test
  public void handlesAreUniqueAndJoinIsHarmless() {
    TaskPool pool = TaskPools.newTaskPool();
    pool.prepare();
    TaskHandle first = pool.push(WorkItem.of(() -> {})).get();
    TaskHandle second = pool.push(WorkItem.of(() -> {})).get();
    pool.join(first);
    pool.join(null);
    pool.cleanup();

    assertNotEquals(first.getId(), second.getId());
  }

  @Test(expected = IllegalStateException.class)
  public void workItemRunsOnlyOnce() throws Exception {
    WorkItem item = WorkItem.of(() -> {});
    item.run();
    item.run();
  }

  private static void cleanupAndRecord(
      TaskPool pool, AtomicInteger finished, AtomicInteger finishedSeen) {
    pool.cleanup();
    finishedSeen.set(finished.get());
  }
}
