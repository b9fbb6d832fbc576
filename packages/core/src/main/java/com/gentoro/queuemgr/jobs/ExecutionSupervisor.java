package com.gentoro.queuemgr.jobs;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.queuemgr.config.QueueMgrSettings;
import com.gentoro.queuemgr.exception.DuplicateJobIdException;
import com.gentoro.queuemgr.exception.ExceptionUtil;
import com.gentoro.queuemgr.exception.InvalidTransitionException;
import com.gentoro.queuemgr.exception.JobNotFoundException;
import com.gentoro.queuemgr.exception.JobNotTerminalException;
import com.gentoro.queuemgr.exception.QueueLimitExceededException;
import com.gentoro.queuemgr.exception.QueueMgrException;
import com.gentoro.queuemgr.exception.StateException;
import com.gentoro.queuemgr.jobs.isolation.ExecutionHandle;
import com.gentoro.queuemgr.jobs.isolation.ExecutionIsolation;
import com.gentoro.queuemgr.jobs.isolation.JobLaunch;
import com.gentoro.queuemgr.jobs.isolation.ProcessIsolation;
import com.gentoro.queuemgr.jobs.isolation.ThreadIsolation;
import com.gentoro.queuemgr.logging.LoggingService;
import com.gentoro.queuemgr.registry.JobError;
import com.gentoro.queuemgr.registry.JobRecord;
import com.gentoro.queuemgr.registry.JobStatus;
import com.gentoro.queuemgr.registry.RegistryStore;
import com.gentoro.queuemgr.utility.JacksonUtility;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;

/**
 * Owns the lifecycle of every job in a {@link RegistryStore}: admission, the bounded worker pool,
 * isolation, timeouts, cancellation and the commit of terminal states.
 *
 * <p>All state changes go through the store, so any registry reader sees the same lifecycle the
 * supervisor drives. Submitting only creates the record; a job enters the worker queue through
 * {@link #start(String)} or {@link #startAll()}, or immediately when auto-start is configured.
 * Queued jobs are picked up first-in first-out by the time they were queued.
 *
 * <p>On construction the supervisor reconciles records left behind by a previous session: RUNNING
 * records become FAILED ({@value JobError#KIND_ORPHANED}) and QUEUED records are queued again as
 * soon as their job type can be resolved.
 */
public final class ExecutionSupervisor implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(ExecutionSupervisor.class);

  private static final TypeReference<Map<String, Object>> PARAMS_TYPE = new TypeReference<>() {};
  private static final int MAX_WARNINGS = 1000;

  private final RegistryStore store;
  private final QueueMgrSettings settings;
  private final ExecutionIsolation isolation;
  private final ResultGuard guard;
  private final Clock clock;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  private final ThreadPoolExecutor executor;
  private final Map<String, JobDefinition> definitions = new ConcurrentHashMap<>();
  private final Map<String, QueuedTask> queued = new ConcurrentHashMap<>();
  private final Map<String, String> awaitingDefinition = new ConcurrentHashMap<>();
  private final Map<String, RunningJob> running = new ConcurrentHashMap<>();
  private final List<SupervisorWarning> warnings = new CopyOnWriteArrayList<>();

  // Guards moves between CREATED, QUEUED and RUNNING so cancel and dequeue never interleave.
  private final ReentrantLock lifecycleLock = new ReentrantLock();
  private final ReentrantLock signalLock = new ReentrantLock();
  private final Condition terminalReached = signalLock.newCondition();
  private final AtomicBoolean closed = new AtomicBoolean();

  public ExecutionSupervisor(RegistryStore store, QueueMgrSettings settings) {
    this(store, settings, isolationFor(settings), Clock.systemUTC());
  }

  public ExecutionSupervisor(
      RegistryStore store, QueueMgrSettings settings, ExecutionIsolation isolation, Clock clock) {
    this.store = store;
    this.settings = settings;
    this.isolation = isolation;
    this.clock = clock;
    this.guard = new ResultGuard(settings.resultWarnBytes(), settings.resultMaxBytes());

    AtomicInteger workerIds = new AtomicInteger();
    this.executor =
        new ThreadPoolExecutor(
            settings.maxConcurrentJobs(),
            settings.maxConcurrentJobs(),
            0L,
            TimeUnit.MILLISECONDS,
            new PriorityBlockingQueue<>(),
            r -> {
              Thread t = new Thread(r, "queuemgr-worker-" + workerIds.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    // every task goes through the priority queue only once all workers exist
    this.executor.prestartAllCoreThreads();

    log.info(
        "Supervisor started: {} worker(s), {} isolation, registry {}",
        settings.maxConcurrentJobs(),
        isolation.name(),
        store.path());
    recoverOrphans();
  }

  static ExecutionIsolation isolationFor(QueueMgrSettings settings) {
    if (QueueMgrSettings.ISOLATION_PROCESS.equals(settings.isolation())) {
      return new ProcessIsolation(settings.processJavaOptions());
    }
    return new ThreadIsolation();
  }

  // --------------------------------------------------------------------
  // Definitions and submission
  // --------------------------------------------------------------------

  /** Make a job type known; recovered QUEUED jobs of that type are queued again. */
  public void register(JobDefinition definition) {
    if (!isolation.supports(definition)) {
      throw new IllegalArgumentException(
          definition + " cannot run with " + isolation.name() + " isolation");
    }
    definitions.put(definition.jobType(), definition);

    lifecycleLock.lock();
    try {
      List<JobRecord> waiting = new ArrayList<>();
      awaitingDefinition.forEach(
          (jobId, type) -> {
            if (type.equals(definition.jobType())) {
              store.get(jobId).ifPresent(waiting::add);
            }
          });
      for (JobRecord record : waiting) {
        awaitingDefinition.remove(record.jobId());
        if (record.status() == JobStatus.QUEUED) {
          enqueue(record, definition);
        }
      }
    } finally {
      lifecycleLock.unlock();
    }
  }

  public String submit(Class<? extends QueueJob> jobClass, String jobId, Map<String, ?> params) {
    JobDefinition definition = definitions.get(jobClass.getName());
    return submit(definition != null ? definition : JobDefinition.of(jobClass), jobId, params);
  }

  /**
   * Create a job in CREATED state.
   *
   * @param jobId caller-chosen id, or {@code null} to generate one
   * @param params JSON-serializable parameters handed to the job
   * @return the job id
   * @throws DuplicateJobIdException when the id is live or was used by a deleted job
   * @throws QueueLimitExceededException when a limit is reached and no terminal job can be evicted
   */
  public String submit(JobDefinition definition, String jobId, Map<String, ?> params) {
    ensureOpen();
    String id = jobId == null ? UUID.randomUUID().toString() : jobId;
    if (id.isBlank()) {
      throw new IllegalArgumentException("jobId must not be blank");
    }
    if (!isolation.supports(definition)) {
      throw new IllegalArgumentException(
          definition + " cannot run with " + isolation.name() + " isolation");
    }
    JsonNode tree = mapper.valueToTree(params == null ? Map.of() : params);
    if (!tree.isObject()) {
      throw new IllegalArgumentException("Job params must be a JSON object");
    }
    definitions.putIfAbsent(definition.jobType(), definition);

    lifecycleLock.lock();
    try {
      if (store.isKnownId(id)) {
        throw new DuplicateJobIdException(id);
      }
      enforceLimits(definition.jobType());
      store.append(JobRecord.created(id, definition.jobType(), tree, clock.instant()));
    } finally {
      lifecycleLock.unlock();
    }
    log.info("Submitted job {} of type {}", id, definition.jobType());

    if (settings.autoStart()) {
      start(id);
    }
    return id;
  }

  /** Move a CREATED job to QUEUED and hand it to the worker pool. */
  public JobStatusView start(String jobId) {
    ensureOpen();
    lifecycleLock.lock();
    try {
      JobRecord current = require(jobId);
      JobDefinition definition = resolveDefinition(current.jobType());
      if (definition == null) {
        throw new StateException(
            "No definition registered for job type '" + current.jobType() + "'");
      }
      JobRecord queuedRecord =
          store.update(jobId, r -> JobStateMachine.admit(r, clock.instant()));
      enqueue(queuedRecord, definition);
      log.debug("Job {} queued", jobId);
      return JobStatusView.fromRecord(queuedRecord);
    } finally {
      lifecycleLock.unlock();
    }
  }

  /**
   * Start every CREATED job in creation order.
   *
   * @return number of jobs queued
   */
  public int startAll() {
    int started = 0;
    for (JobRecord record : store.list()) {
      if (record.status() == JobStatus.CREATED) {
        try {
          start(record.jobId());
          started++;
        } catch (InvalidTransitionException | JobNotFoundException e) {
          // changed concurrently since the listing
          log.debug("Skipping job {}: {}", record.jobId(), e.getMessage());
        }
      }
    }
    return started;
  }

  // --------------------------------------------------------------------
  // Cancellation and deletion
  // --------------------------------------------------------------------

  /**
   * Cancel a job. CREATED and QUEUED jobs become CANCELLED at once; a RUNNING job is asked to stop
   * and becomes CANCELLED when it does. Cancelling a CANCELLED job does nothing.
   *
   * @throws InvalidTransitionException when the job already COMPLETED or FAILED
   */
  public JobStatusView cancel(String jobId) {
    lifecycleLock.lock();
    try {
      JobRecord current = require(jobId);
      switch (current.status()) {
        case CANCELLED:
          return JobStatusView.fromRecord(current);
        case COMPLETED:
        case FAILED:
          throw new InvalidTransitionException(
              jobId, current.status().name(), JobStatus.CANCELLED.name());
        case CREATED:
        case QUEUED:
          QueuedTask task = queued.remove(jobId);
          if (task != null) {
            executor.remove(task);
          }
          awaitingDefinition.remove(jobId);
          JobRecord cancelled =
              store.update(jobId, r -> JobStateMachine.cancel(r, "Job cancelled", clock.instant()));
          log.info("Job {} cancelled before it ran", jobId);
          signalTerminal();
          return JobStatusView.fromRecord(cancelled);
        case RUNNING:
        default:
          RunningJob job = running.get(jobId);
          if (job != null && job.requestCancel(false)) {
            log.info("Cancellation requested for running job {}", jobId);
            JobRecord flagged =
                store.update(
                    jobId,
                    r ->
                        r.status() == JobStatus.RUNNING
                            ? r.withProgress(
                                r.progress(), "Cancellation requested", clock.instant())
                            : r);
            return JobStatusView.fromRecord(flagged);
          }
          return JobStatusView.fromRecord(require(jobId));
      }
    } finally {
      lifecycleLock.unlock();
    }
  }

  /** Same as {@link #cancel(String)}. */
  public JobStatusView stop(String jobId) {
    return cancel(jobId);
  }

  /**
   * Remove a terminal job. Its id stays reserved.
   *
   * @throws JobNotTerminalException when the job has not finished
   */
  public void delete(String jobId) {
    ensureOpen();
    JobRecord current = require(jobId);
    if (!current.status().isTerminal()) {
      throw new JobNotTerminalException(jobId, current.status().name());
    }
    store.delete(jobId);
    log.info("Deleted job {}", jobId);
  }

  // --------------------------------------------------------------------
  // Queries
  // --------------------------------------------------------------------

  public JobStatusView getStatus(String jobId) {
    return JobStatusView.fromRecord(require(jobId));
  }

  public Optional<JobStatusView> find(String jobId) {
    return store.get(jobId).map(JobStatusView::fromRecord);
  }

  public List<JobStatusView> list() {
    return store.list().stream().map(JobStatusView::fromRecord).toList();
  }

  public List<JobStatusView> list(Set<JobStatus> statuses) {
    return store.list().stream()
        .filter(r -> statuses.contains(r.status()))
        .map(JobStatusView::fromRecord)
        .toList();
  }

  /** Status of every job, in creation order. */
  public Map<String, JobStatus> listStatuses() {
    Map<String, JobStatus> out = new LinkedHashMap<>();
    for (JobRecord record : store.list()) {
      out.put(record.jobId(), record.status());
    }
    return out;
  }

  public List<String> runningJobIds() {
    return store.list().stream()
        .filter(r -> r.status() == JobStatus.RUNNING)
        .map(JobRecord::jobId)
        .toList();
  }

  public int jobCount() {
    return store.size();
  }

  /**
   * Block until the job reaches a terminal state or {@code timeout} elapses.
   *
   * @return the job's status at that point, terminal or not
   */
  public JobStatusView awaitTerminal(String jobId, Duration timeout) throws InterruptedException {
    long remaining = timeout.toNanos();
    signalLock.lock();
    try {
      while (true) {
        JobRecord current = require(jobId);
        if (current.status().isTerminal() || remaining <= 0) {
          return JobStatusView.fromRecord(current);
        }
        remaining = terminalReached.awaitNanos(remaining);
      }
    } finally {
      signalLock.unlock();
    }
  }

  /** Non-fatal problems seen so far, such as failing lifecycle hooks. */
  public List<SupervisorWarning> warnings() {
    return List.copyOf(warnings);
  }

  public ExecutionIsolation isolation() {
    return isolation;
  }

  // --------------------------------------------------------------------
  // Maintenance
  // --------------------------------------------------------------------

  /**
   * Delete jobs whose last update is older than the policy's age. RUNNING jobs are never removed;
   * CREATED and QUEUED ones only when the policy is not terminal-only, after being cancelled.
   *
   * @return number of jobs deleted
   */
  public int cleanup(RetentionPolicy policy) {
    ensureOpen();
    Instant cutoff = clock.instant().minus(policy.maxAge());
    List<String> expired = new ArrayList<>();
    for (JobRecord record : store.list()) {
      if (!record.updatedAt().isBefore(cutoff)) {
        continue;
      }
      JobStatus status = record.status();
      if (status.isTerminal()) {
        expired.add(record.jobId());
      } else if (!policy.terminalOnly()
          && (status == JobStatus.CREATED || status == JobStatus.QUEUED)) {
        try {
          if (cancel(record.jobId()).isTerminal()) {
            expired.add(record.jobId());
          }
        } catch (InvalidTransitionException e) {
          // finished meanwhile; it will expire on a later pass
          log.debug("Not expiring job {}: {}", record.jobId(), e.getMessage());
        }
      }
    }
    expired.removeIf(id -> store.get(id).isEmpty());
    if (expired.isEmpty()) {
      return 0;
    }
    int removed = store.deleteAll(expired);
    log.info("Retention removed {} job(s) older than {}", removed, policy.maxAge());
    return removed;
  }

  public void compact() {
    ensureOpen();
    store.compact();
  }

  /**
   * Stop accepting work and wind down. Queued jobs stay QUEUED in the registry and are picked up
   * by the next supervisor. Running jobs get the shutdown timeout to finish, then are cancelled;
   * whatever still runs after the cancel grace period is terminated or abandoned.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    lifecycleLock.lock();
    try {
      List<Runnable> drained = new ArrayList<>();
      executor.getQueue().drainTo(drained);
      queued.clear();
      if (!drained.isEmpty()) {
        log.info("{} queued job(s) left for the next session", drained.size());
      }
    } finally {
      lifecycleLock.unlock();
    }
    executor.shutdown();
    try {
      long timeout = settings.shutdownTimeout().toMillis();
      if (!executor.awaitTermination(timeout, TimeUnit.MILLISECONDS)) {
        log.warn("{} job(s) still running after shutdown timeout, cancelling", running.size());
        executor.shutdownNow();
        long grace = settings.cancelGrace().toMillis() * 2 + 1000;
        if (!executor.awaitTermination(grace, TimeUnit.MILLISECONDS)) {
          log.warn("Workers did not stop within {} ms", grace);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    log.info("Supervisor stopped");
  }

  // --------------------------------------------------------------------
  // Internals
  // --------------------------------------------------------------------

  private void recoverOrphans() {
    int orphaned = 0;
    int requeued = 0;
    lifecycleLock.lock();
    try {
      for (JobRecord record : store.list()) {
        if (record.status() == JobStatus.RUNNING) {
          store.update(
              record.jobId(),
              r ->
                  JobStateMachine.fail(
                      r,
                      JobError.of(
                          JobError.KIND_ORPHANED,
                          "Job was running when the previous supervisor stopped"),
                      clock.instant()));
          orphaned++;
        } else if (record.status() == JobStatus.QUEUED) {
          JobDefinition definition = resolveDefinition(record.jobType());
          if (definition != null && isolation.supports(definition)) {
            enqueue(record, definition);
            requeued++;
          } else {
            awaitingDefinition.put(record.jobId(), record.jobType());
          }
        }
      }
    } finally {
      lifecycleLock.unlock();
    }
    if (orphaned > 0 || requeued > 0 || !awaitingDefinition.isEmpty()) {
      log.warn(
          "Recovered registry: {} orphaned job(s) failed, {} requeued, {} waiting for a definition",
          orphaned,
          requeued,
          awaitingDefinition.size());
    }
  }

  private JobDefinition resolveDefinition(String jobType) {
    JobDefinition definition = definitions.get(jobType);
    if (definition != null) {
      return definition;
    }
    try {
      ClassLoader loader = Thread.currentThread().getContextClassLoader();
      definition = JobDefinition.forClassName(jobType, loader);
    } catch (ClassNotFoundException | IllegalArgumentException | LinkageError e) {
      log.debug("Job type {} is not a loadable job class: {}", jobType, e.toString());
      return null;
    }
    JobDefinition existing = definitions.putIfAbsent(jobType, definition);
    return existing != null ? existing : definition;
  }

  /** Make room for one more job, evicting the oldest terminal jobs where a limit is reached. */
  private void enforceLimits(String jobType) {
    if (settings.maxJobs() > 0) {
      evictUntilBelow(settings.maxJobs(), null);
    }
    Integer typeLimit = settings.typeLimits().get(jobType);
    if (typeLimit != null) {
      evictUntilBelow(typeLimit, jobType);
    }
  }

  private void evictUntilBelow(int limit, String jobType) {
    List<JobRecord> scope =
        store.list().stream().filter(r -> jobType == null || jobType.equals(r.jobType())).toList();
    int excess = scope.size() - limit + 1;
    if (excess <= 0) {
      return;
    }
    List<String> victims =
        scope.stream()
            .filter(r -> r.status().isTerminal())
            .sorted(Comparator.comparing(JobRecord::updatedAt).thenComparing(JobRecord::jobId))
            .limit(excess)
            .map(JobRecord::jobId)
            .toList();
    if (victims.size() < excess) {
      String what = jobType == null ? "jobs" : "jobs of type " + jobType;
      throw new QueueLimitExceededException(
              "Limit of " + limit + " " + what + " reached and no finished job can be evicted")
          .withContext("limit", limit)
          .withContext("jobType", jobType);
    }
    store.deleteAll(victims);
    log.info("Evicted {} finished job(s) to stay within limit {}", victims.size(), limit);
  }

  private void enqueue(JobRecord record, JobDefinition definition) {
    QueuedTask task = new QueuedTask(record.jobId(), definition, record.updatedAt());
    queued.put(record.jobId(), task);
    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) {
      queued.remove(record.jobId());
      throw new StateException("Supervisor is shut down");
    }
  }

  private void runQueued(QueuedTask task) {
    String jobId = task.jobId;
    RunningJob job;
    JobRecord started;
    lifecycleLock.lock();
    try {
      if (queued.remove(jobId) != task) {
        return;
      }
      started = store.update(jobId, r -> JobStateMachine.start(r, clock.instant()));
      job = new RunningJob(jobId);
      running.put(jobId, job);
    } catch (QueueMgrException e) {
      log.error("Cannot start job {}", jobId, e);
      return;
    } finally {
      lifecycleLock.unlock();
    }
    log.info("Job {} started", jobId);

    try {
      Map<String, Object> params = mapper.convertValue(started.params(), PARAMS_TYPE);
      ExecutionHandle handle =
          isolation.launch(
              new JobLaunch(
                  task.definition, jobId, params, guard, (p, d) -> reportProgress(jobId, p, d)));
      job.attach(handle);
      commit(job, awaitOutcome(job, handle));
    } catch (RuntimeException e) {
      log.error("Job {} could not be executed", jobId, e);
      commit(job, JobOutcome.failed(ExceptionUtil.toJobError(e), false, List.of()));
    } finally {
      running.remove(jobId);
      signalTerminal();
    }
  }

  /** Wait for the outcome; {@code null} means the job was stopped without reporting one. */
  private JobOutcome awaitOutcome(RunningJob job, ExecutionHandle handle) {
    try {
      try {
        Duration timeout = settings.jobTimeout();
        if (timeout == null) {
          return handle.outcome().get();
        }
        return handle.outcome().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        log.warn("Job {} exceeded its timeout of {}", job.jobId, settings.jobTimeout());
        job.timedOut = true;
        job.requestCancel(false);
      } catch (InterruptedException e) {
        log.warn("Supervisor shutting down, cancelling job {}", job.jobId);
        job.requestCancel(true);
      }
      return stopWithinGrace(job, handle);
    } catch (ExecutionException e) {
      return JobOutcome.failed(ExceptionUtil.toJobError(e.getCause()), false, List.of());
    }
  }

  private JobOutcome stopWithinGrace(RunningJob job, ExecutionHandle handle)
      throws ExecutionException {
    long grace = settings.cancelGrace().toMillis();
    try {
      return handle.outcome().get(grace, TimeUnit.MILLISECONDS);
    } catch (TimeoutException | InterruptedException e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      if (handle.terminate()) {
        try {
          handle.outcome().get(grace, TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException again) {
          log.warn("Job {} did not exit after termination", job.jobId);
        }
      }
      return null;
    }
  }

  private void commit(RunningJob job, JobOutcome outcome) {
    String jobId = job.jobId;
    if (outcome != null) {
      recordWarnings(outcome.warnings());
    }
    JobRecord committed;
    try {
      committed =
          store.update(
              jobId,
              r -> r.status() == JobStatus.RUNNING ? terminalRecord(job, outcome, r) : r);
    } catch (QueueMgrException e) {
      log.error("Cannot record the outcome of job {}", jobId, e);
      return;
    }
    switch (committed.status()) {
      case COMPLETED -> log.info("Job {} completed ({} bytes)", jobId, committed.sizeBytes());
      case CANCELLED -> log.info("Job {} cancelled", jobId);
      case FAILED ->
          log.warn(
              "Job {} failed: {}: {}",
              jobId,
              committed.error().kind(),
              committed.error().message());
      default -> log.warn("Job {} left in state {}", jobId, committed.status());
    }
  }

  private JobRecord terminalRecord(RunningJob job, JobOutcome outcome, JobRecord current) {
    Instant now = clock.instant();
    boolean stoppedOnRequest =
        outcome != null
            && (outcome.isCancellationFault()
                || (outcome.isSuccess() && outcome.cancelObserved()));
    if (job.cancelRequested.get() && stoppedOnRequest) {
      String reason;
      if (job.timedOut) {
        reason = "Job cancelled after exceeding its timeout of " + settings.jobTimeout();
      } else if (job.shutdown) {
        reason = "Job cancelled by supervisor shutdown";
      } else {
        reason = "Job cancelled";
      }
      return JobStateMachine.cancel(current, reason, now);
    }
    // a timed out job that did not yield to the cancel request
    if (job.timedOut) {
      return JobStateMachine.fail(
          current,
          JobError.of(
              JobError.KIND_TIMEOUT, "Job exceeded its timeout of " + settings.jobTimeout()),
          now);
    }
    if (outcome == null) {
      return JobStateMachine.cancel(current, "Job cancelled by supervisor shutdown", now);
    }
    if (outcome.isSuccess()) {
      return JobStateMachine.complete(current, outcome.result(), outcome.sizeBytes(), now);
    }
    return JobStateMachine.fail(current, outcome.fault(), now);
  }

  private void reportProgress(String jobId, int percent, String description) {
    try {
      store.update(
          jobId,
          r ->
              r.status() == JobStatus.RUNNING
                  ? r.withProgress(percent, description, clock.instant())
                  : r);
    } catch (QueueMgrException e) {
      log.warn("Dropping progress update of job {}: {}", jobId, e.getMessage());
    }
  }

  private void recordWarnings(List<SupervisorWarning> batch) {
    for (SupervisorWarning warning : batch) {
      warnings.add(warning);
    }
    while (warnings.size() > MAX_WARNINGS) {
      warnings.remove(0);
    }
  }

  private void signalTerminal() {
    signalLock.lock();
    try {
      terminalReached.signalAll();
    } finally {
      signalLock.unlock();
    }
  }

  private JobRecord require(String jobId) {
    return store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new StateException("Supervisor is closed");
    }
  }

  /** Worker queue entry; ordered by the time the job was queued, then by id. */
  private final class QueuedTask implements Runnable, Comparable<QueuedTask> {
    private final String jobId;
    private final JobDefinition definition;
    private final Instant queuedAt;

    QueuedTask(String jobId, JobDefinition definition, Instant queuedAt) {
      this.jobId = jobId;
      this.definition = definition;
      this.queuedAt = queuedAt;
    }

    @Override
    public void run() {
      runQueued(this);
    }

    @Override
    public int compareTo(QueuedTask other) {
      int byTime = queuedAt.compareTo(other.queuedAt);
      return byTime != 0 ? byTime : jobId.compareTo(other.jobId);
    }
  }

  /** Supervisor-side state of a job that holds a worker slot. */
  private static final class RunningJob {
    private final String jobId;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private volatile ExecutionHandle handle;
    private volatile boolean timedOut;
    private volatile boolean shutdown;

    RunningJob(String jobId) {
      this.jobId = jobId;
    }

    void attach(ExecutionHandle handle) {
      this.handle = handle;
      if (cancelRequested.get()) {
        handle.requestCancel();
      }
    }

    /** @return {@code true} for the first request only */
    boolean requestCancel(boolean forShutdown) {
      if (forShutdown) {
        shutdown = true;
      }
      boolean first = cancelRequested.compareAndSet(false, true);
      ExecutionHandle h = handle;
      if (h != null) {
        h.requestCancel();
      }
      return first;
    }
  }
}
