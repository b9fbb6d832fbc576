package com.gentoro.queuemgr.jobs;

import com.gentoro.queuemgr.exception.ExceptionUtil;
import com.gentoro.queuemgr.logging.LoggingService;
import com.gentoro.queuemgr.registry.JobError;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Runs one job instance through its hooks inside the current execution context and folds the
 * result through the {@link ResultGuard}.
 *
 * <p>This is the code both isolation modes execute: a worker thread calls it directly and a child
 * process calls it from {@code ChildJobRunner}. It never throws; every failure ends up in the
 * returned {@link JobOutcome}.
 */
public final class JobLifecycle {
  private static final Logger log = LoggingService.getLogger(JobLifecycle.class);

  private JobLifecycle() {}

  public static JobOutcome run(
      JobDefinition definition,
      String jobId,
      Map<String, Object> params,
      JobContext context,
      ResultGuard guard) {
    List<SupervisorWarning> warnings = new ArrayList<>();

    QueueJob job;
    try {
      job = definition.instantiate(jobId, params);
    } catch (Throwable t) {
      log.error("Cannot instantiate job {} of type {}", jobId, definition.jobType(), t);
      return JobOutcome.failed(ExceptionUtil.toJobError(t), false, warnings);
    }

    hook(jobId, "onStart", warnings, job::onStart);

    Object value = null;
    Throwable fault = null;
    try {
      value = job.execute(context);
    } catch (Throwable t) {
      fault = t;
    }

    if (fault != null) {
      final Throwable f = fault;
      hook(jobId, "onError", warnings, () -> job.onError(f));
    }
    hook(jobId, "onEnd", warnings, job::onEnd);

    if (fault != null) {
      if (fault instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      log.debug("Job {} raised {}", jobId, fault.toString());
      return JobOutcome.failed(
          ExceptionUtil.toJobError(fault), context.cancellationObserved(), warnings);
    }

    GuardVerdict verdict;
    try {
      verdict = guard.validate(value);
    } catch (Throwable t) {
      // errors raised by the result's own accessors while it is serialized
      log.warn("Validating the result of job {} failed: {}", jobId, t.toString());
      return JobOutcome.failed(
          ExceptionUtil.toJobError(t), context.cancellationObserved(), warnings);
    }
    if (!verdict.isAccepted()) {
      log.warn("Result of job {} rejected: {}", jobId, verdict.rejection().getMessage());
      JobError error =
          new JobError(
              JobError.KIND_RESULT_REJECTED,
              verdict.rejection().getMessage(),
              verdict.rejection().getReason().name());
      return JobOutcome.rejected(error, context.cancellationObserved(), warnings);
    }
    return JobOutcome.completed(
        verdict.value(), verdict.sizeBytes(), context.cancellationObserved(), warnings);
  }

  @FunctionalInterface
  private interface Hook {
    void call() throws Exception;
  }

  private static void hook(String jobId, String name, List<SupervisorWarning> warnings, Hook hook) {
    try {
      hook.call();
    } catch (Throwable t) {
      log.warn("Hook {} of job {} failed: {}", name, jobId, t.toString());
      String message = t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
      warnings.add(new SupervisorWarning(jobId, name, message, Instant.now()));
    }
  }
}
