package com.gentoro.queuemgr.jobs.isolation;

import com.gentoro.queuemgr.jobs.JobContext;
import com.gentoro.queuemgr.jobs.JobLifecycle;
import com.gentoro.queuemgr.jobs.JobOutcome;
import com.gentoro.queuemgr.logging.LoggingService;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;

/**
 * Runs each job on a dedicated daemon thread of the supervising process.
 *
 * <p>Cancellation sets a flag the job polls and interrupts the thread. A job that ignores both
 * cannot be stopped; on timeout it is abandoned and keeps its thread until it returns.
 */
public final class ThreadIsolation implements ExecutionIsolation {
  private static final Logger log = LoggingService.getLogger(ThreadIsolation.class);

  @Override
  public ExecutionHandle launch(JobLaunch launch) {
    AtomicBoolean cancelled = new AtomicBoolean();
    CompletableFuture<JobOutcome> outcome = new CompletableFuture<>();
    JobContext context =
        new JobContext(
            launch.jobId(),
            launch.definition().jobType(),
            () -> cancelled.get() || Thread.currentThread().isInterrupted(),
            launch.progress());
    Thread thread =
        new Thread(
            () -> {
              try {
                outcome.complete(
                    JobLifecycle.run(
                        launch.definition(),
                        launch.jobId(),
                        launch.params(),
                        context,
                        launch.guard()));
              } catch (Throwable t) {
                // the outcome must complete or the worker slot is held forever
                log.error("Job {} escaped its lifecycle", launch.jobId(), t);
                outcome.completeExceptionally(t);
              }
            },
            "queuemgr-job-" + launch.jobId());
    thread.setDaemon(true);
    thread.start();
    return new Handle(launch.jobId(), thread, cancelled, outcome);
  }

  @Override
  public boolean supportsTermination() {
    return false;
  }

  @Override
  public String name() {
    return "thread";
  }

  private record Handle(
      String jobId, Thread thread, AtomicBoolean cancelled, CompletableFuture<JobOutcome> outcome)
      implements ExecutionHandle {

    @Override
    public void requestCancel() {
      if (cancelled.compareAndSet(false, true) && !outcome.isDone()) {
        thread.interrupt();
      }
    }

    @Override
    public boolean terminate() {
      if (!outcome.isDone()) {
        log.warn("Abandoning job {}: thread {} does not respond to cancellation", jobId, thread);
      }
      return false;
    }
  }
}
