package com.gentoro.queuemgr.jobs;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** Job implementations used by the supervisor and isolation tests. */
public final class TestJobs {
  /** Ids in the order {@link RecordingJob} instances ran. */
  public static final ConcurrentLinkedQueue<String> EXECUTION_ORDER = new ConcurrentLinkedQueue<>();

  private static final Map<String, CountDownLatch> STARTED = new ConcurrentHashMap<>();
  private static final Map<String, CountDownLatch> RELEASED = new ConcurrentHashMap<>();

  private TestJobs() {}

  private static CountDownLatch latch(Map<String, CountDownLatch> latches, String jobId) {
    return latches.computeIfAbsent(jobId, k -> new CountDownLatch(1));
  }

  /** Waits until the job with this id began executing. */
  public static boolean awaitStarted(String jobId, Duration timeout) throws InterruptedException {
    return latch(STARTED, jobId).await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Lets a waiting {@link GateJob} return. */
  public static void release(String jobId) {
    latch(RELEASED, jobId).countDown();
  }

  public static void resetLatches() {
    STARTED.clear();
    RELEASED.clear();
  }

  /** Signals its start, then holds until released or cancelled. */
  public static class GateJob extends QueueJobBase {
    public GateJob(String jobId, Map<String, Object> params) {
      super(jobId, params);
    }

    @Override
    public Object execute(JobContext context) throws Exception {
      latch(STARTED, jobId()).countDown();
      CountDownLatch released = latch(RELEASED, jobId());
      while (!released.await(10, TimeUnit.MILLISECONDS)) {
        context.throwIfCancelled();
      }
      return "released";
    }
  }

  /** Sums 1..n. */
  public static class SumJob extends QueueJobBase {
    public SumJob(String jobId, Map<String, Object> params) {
      super(jobId, params);
    }

    @Override
    public Object execute(JobContext context) {
      int n = param("n", Integer.class);
      long sum = 0;
      for (int i = 1; i <= n; i++) {
        sum += i;
      }
      context.reportProgress(100, "summed " + n + " numbers");
      return Map.of("sum", sum);
    }
  }

  public static class FailingJob extends QueueJobBase {
    public FailingJob(String jobId, Map<String, Object> params) {
      super(jobId, params);
    }

    @Override
    public Object execute(JobContext context) {
      throw new IllegalStateException("boom");
    }
  }

  /** Sleeps in small steps for {@code millis}, honouring cancellation. */
  public static class SleepingJob extends QueueJobBase {
    public SleepingJob(String jobId, Map<String, Object> params) {
      super(jobId, params);
    }

    @Override
    public Object execute(JobContext context) throws Exception {
      long millis = param("millis", Long.class, 5_000L);
      long steps = Math.max(1, millis / 10);
      for (long i = 0; i < steps; i++) {
        context.throwIfCancelled();
        Thread.sleep(10);
        context.reportProgress((int) (i * 100 / steps), "step " + i);
      }
      return "slept";
    }
  }

  /** Stops early and returns normally once it sees a cancellation request. */
  public static class ObservingJob extends QueueJobBase {
    public ObservingJob(String jobId, Map<String, Object> params) {
      super(jobId, params);
    }

    @Override
    public Object execute(JobContext context) {
      latch(STARTED, jobId()).countDown();
      long deadline = System.currentTimeMillis() + 5_000;
      while (System.currentTimeMillis() < deadline) {
        if (context.isCancelled()) {
          return "partial";
        }
        Thread.onSpinWait();
      }
      return "full";
    }
  }

  /** Busy-waits for {@code millis} without looking at cancellation or interrupts. */
  public static class StubbornJob extends QueueJobBase {
    public StubbornJob(String jobId, Map<String, Object> params) {
      super(jobId, params);
    }

    @Override
    public Object execute(JobContext context) {
      long deadline = System.currentTimeMillis() + param("millis", Long.class, 60_000L);
      while (System.currentTimeMillis() < deadline) {
        Thread.onSpinWait();
      }
      return "finally";
    }
  }

  /** Returns a string of {@code bytes} characters. */
  public static class LargeResultJob extends QueueJobBase {
    public LargeResultJob(String jobId, Map<String, Object> params) {
      super(jobId, params);
    }

    @Override
    public Object execute(JobContext context) {
      return "x".repeat(param("bytes", Integer.class));
    }
  }

  public static class UnserializableResultJob extends QueueJobBase {
    public UnserializableResultJob(String jobId, Map<String, Object> params) {
      super(jobId, params);
    }

    @Override
    public Object execute(JobContext context) {
      return new Exploding();
    }
  }

  /** Bean whose only property cannot be read. */
  public static class Exploding {
    public String getValue() {
      throw new UnsupportedOperationException("not readable");
    }
  }

  public static class AssertingResultJob extends QueueJobBase {
    public AssertingResultJob(String jobId, Map<String, Object> params) {
      super(jobId, params);
    }

    @Override
    public Object execute(JobContext context) {
      return new Asserting();
    }
  }

  /** Bean whose getter fails with an {@link Error} rather than an exception. */
  public static class Asserting {
    public String getValue() {
      throw new AssertionError("getter invariant broken");
    }
  }

  /** Records its id in {@link #EXECUTION_ORDER}. */
  public static class RecordingJob extends QueueJobBase {
    public RecordingJob(String jobId, Map<String, Object> params) {
      super(jobId, params);
    }

    @Override
    public Object execute(JobContext context) {
      EXECUTION_ORDER.add(jobId());
      return List.of(jobId());
    }
  }

  /** Kills its own JVM; only meaningful with process isolation. */
  public static class ExitingJob extends QueueJobBase {
    public ExitingJob(String jobId, Map<String, Object> params) {
      super(jobId, params);
    }

    @Override
    public Object execute(JobContext context) {
      Runtime.getRuntime().halt(3);
      return null;
    }
  }

  /** Tracks how many instances execute at the same time. */
  public static class ConcurrencyTrackingJob extends QueueJobBase {
    private static final AtomicInteger ACTIVE = new AtomicInteger();
    private static final AtomicInteger MAX_ACTIVE = new AtomicInteger();

    public ConcurrencyTrackingJob(String jobId, Map<String, Object> params) {
      super(jobId, params);
    }

    public static void reset() {
      ACTIVE.set(0);
      MAX_ACTIVE.set(0);
    }

    public static int maxActive() {
      return MAX_ACTIVE.get();
    }

    @Override
    public Object execute(JobContext context) throws Exception {
      int now = ACTIVE.incrementAndGet();
      MAX_ACTIVE.accumulateAndGet(now, Math::max);
      try {
        Thread.sleep(param("millis", Long.class));
      } finally {
        ACTIVE.decrementAndGet();
      }
      return now;
    }
  }
}
