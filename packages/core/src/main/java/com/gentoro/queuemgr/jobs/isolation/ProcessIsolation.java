package com.gentoro.queuemgr.jobs.isolation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.queuemgr.jobs.JobDefinition;
import com.gentoro.queuemgr.jobs.JobOutcome;
import com.gentoro.queuemgr.logging.LoggingService;
import com.gentoro.queuemgr.registry.JobError;
import com.gentoro.queuemgr.utility.JacksonUtility;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;

/**
 * Runs each job in a child JVM that shares the supervisor's class path.
 *
 * <p>Only class-based {@link JobDefinition}s can run here since the child instantiates the job by
 * class name. Cancellation is sent as a command line on the child's standard input; termination
 * destroys the process.
 */
public final class ProcessIsolation implements ExecutionIsolation {
  private static final Logger log = LoggingService.getLogger(ProcessIsolation.class);

  /** Fault kind of a child that ended without reporting an outcome. */
  public static final String KIND_PROCESS_EXITED = "ProcessExited";

  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();
  private final List<String> javaOptions;
  private final String classPath;

  public ProcessIsolation() {
    this(List.of());
  }

  public ProcessIsolation(List<String> javaOptions) {
    this(javaOptions, System.getProperty("java.class.path"));
  }

  public ProcessIsolation(List<String> javaOptions, String classPath) {
    this.javaOptions = List.copyOf(javaOptions);
    this.classPath = classPath;
  }

  @Override
  public boolean supports(JobDefinition definition) {
    return definition.jobClass() != null;
  }

  @Override
  public boolean supportsTermination() {
    return true;
  }

  @Override
  public String name() {
    return "process";
  }

  @Override
  public ExecutionHandle launch(JobLaunch launch) {
    if (!supports(launch.definition())) {
      throw new IllegalArgumentException(
          "Job type " + launch.definition().jobType() + " has no job class to run in a process");
    }
    ChildProtocol.Request request =
        new ChildProtocol.Request(
            launch.jobId(),
            launch.definition().jobType(),
            launch.definition().jobClass().getName(),
            launch.params(),
            launch.guard().warnBytes(),
            launch.guard().maxBytes());

    Process process;
    try {
      process =
          new ProcessBuilder(command()).redirectError(ProcessBuilder.Redirect.INHERIT).start();
    } catch (IOException e) {
      throw new IllegalStateException("Cannot start child process for job " + launch.jobId(), e);
    }
    log.debug("Started child process {} for job {}", process.pid(), launch.jobId());

    Writer stdin =
        new BufferedWriter(
            new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    ChildHandle handle = new ChildHandle(launch.jobId(), process, stdin);
    try {
      handle.send(mapper.writeValueAsString(request));
    } catch (IOException e) {
      process.destroyForcibly();
      throw new IllegalStateException("Cannot send request to child of job " + launch.jobId(), e);
    }

    Thread pump = new Thread(() -> pump(launch, handle), "queuemgr-child-" + launch.jobId());
    pump.setDaemon(true);
    pump.start();
    return handle;
  }

  List<String> command() {
    List<String> cmd = new ArrayList<>();
    cmd.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
    cmd.addAll(javaOptions);
    cmd.add("-cp");
    cmd.add(classPath);
    cmd.add(ChildJobRunner.class.getName());
    return cmd;
  }

  /** Reads child events until the stream ends, then completes the handle's outcome. */
  private void pump(JobLaunch launch, ChildHandle handle) {
    AtomicReference<JobOutcome> reported = new AtomicReference<>();
    try (BufferedReader out =
        new BufferedReader(
            new InputStreamReader(handle.process.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = out.readLine()) != null) {
        if (line.isBlank()) continue;
        ChildProtocol.Event event;
        try {
          event = mapper.readValue(line, ChildProtocol.Event.class);
        } catch (IOException e) {
          log.warn("Job {}: ignoring unreadable child output: {}", launch.jobId(), line);
          continue;
        }
        if (ChildProtocol.EVENT_PROGRESS.equals(event.event()) && event.progress() != null) {
          if (launch.progress() != null) {
            launch.progress().reportProgress(event.progress(), event.description());
          }
        } else if (ChildProtocol.EVENT_OUTCOME.equals(event.event()) && event.outcome() != null) {
          reported.set(event.outcome());
        }
      }
    } catch (IOException | RuntimeException e) {
      log.warn("Job {}: lost connection to child process: {}", launch.jobId(), e.toString());
    }

    int exitCode;
    try {
      exitCode = handle.process.waitFor();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      handle.process.destroyForcibly();
      exitCode = -1;
    }
    handle.closeInput();

    JobOutcome outcome = reported.get();
    if (outcome == null) {
      String message =
          handle.terminated.get()
              ? "Child process was terminated"
              : "Child process exited with code " + exitCode + " before reporting an outcome";
      outcome =
          new JobOutcome(
              null, 0L, JobError.of(KIND_PROCESS_EXITED, message), false, false, List.of());
    }
    handle.outcome.complete(outcome);
  }

  private static final class ChildHandle implements ExecutionHandle {
    private final String jobId;
    private final Process process;
    private final Writer stdin;
    private final CompletableFuture<JobOutcome> outcome = new CompletableFuture<>();
    private final AtomicBoolean cancelSent = new AtomicBoolean();
    private final AtomicBoolean terminated = new AtomicBoolean();

    ChildHandle(String jobId, Process process, Writer stdin) {
      this.jobId = jobId;
      this.process = process;
      this.stdin = stdin;
    }

    synchronized void send(String line) throws IOException {
      stdin.write(line);
      stdin.write('\n');
      stdin.flush();
    }

    synchronized void closeInput() {
      try {
        stdin.close();
      } catch (IOException e) {
        log.debug("Job {}: closing child input failed: {}", jobId, e.toString());
      }
    }

    @Override
    public CompletableFuture<JobOutcome> outcome() {
      return outcome;
    }

    @Override
    public void requestCancel() {
      if (!cancelSent.compareAndSet(false, true) || outcome.isDone()) {
        return;
      }
      try {
        send(ChildProtocol.CANCEL);
      } catch (IOException e) {
        // the child is already gone; its exit completes the outcome
        log.debug("Job {}: cancel not delivered: {}", jobId, e.toString());
      }
    }

    @Override
    public boolean terminate() {
      if (process.isAlive()) {
        terminated.set(true);
        log.warn("Terminating child process {} of job {}", process.pid(), jobId);
        process.destroyForcibly();
      }
      return true;
    }
  }
}
