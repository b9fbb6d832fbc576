package com.gentoro.queuemgr.jobs.isolation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.queuemgr.exception.ExceptionUtil;
import com.gentoro.queuemgr.jobs.JobContext;
import com.gentoro.queuemgr.jobs.JobDefinition;
import com.gentoro.queuemgr.jobs.JobLifecycle;
import com.gentoro.queuemgr.jobs.JobOutcome;
import com.gentoro.queuemgr.jobs.ResultGuard;
import com.gentoro.queuemgr.logging.LoggingService;
import com.gentoro.queuemgr.registry.JobError;
import com.gentoro.queuemgr.utility.JacksonUtility;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;

/**
 * Entry point of the child JVM started by {@link ProcessIsolation}.
 *
 * <p>Standard output is reserved for protocol events; anything the job prints goes to standard
 * error instead.
 */
public final class ChildJobRunner {
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();
  private final PrintStream protocol;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  private ChildJobRunner(PrintStream protocol) {
    this.protocol = protocol;
  }

  public static void main(String[] args) {
    PrintStream protocol = new PrintStream(System.out, false, StandardCharsets.UTF_8);
    System.setOut(System.err);
    int exitCode = new ChildJobRunner(protocol).run(System.in);
    protocol.flush();
    System.exit(exitCode);
  }

  int run(InputStream in) {
    Logger log = LoggingService.getLogger(ChildJobRunner.class);
    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    ChildProtocol.Request request;
    try {
      String first = reader.readLine();
      if (first == null) {
        log.error("No job request received on standard input");
        return 2;
      }
      request = mapper.readValue(first, ChildProtocol.Request.class);
    } catch (IOException e) {
      log.error("Cannot read job request", e);
      return 2;
    }

    Thread worker = Thread.currentThread();
    Thread commands = new Thread(() -> readCommands(reader, worker), "queuemgr-child-commands");
    commands.setDaemon(true);
    commands.start();

    JobOutcome outcome;
    try {
      JobDefinition definition =
          JobDefinition.forClassName(
              request.jobClass(), Thread.currentThread().getContextClassLoader());
      JobContext context =
          new JobContext(
              request.jobId(),
              request.jobType(),
              () -> cancelled.get() || Thread.currentThread().isInterrupted(),
              (percent, description) -> emit(ChildProtocol.Event.progress(percent, description)));
      Map<String, Object> params = request.params() == null ? Map.of() : request.params();
      outcome =
          JobLifecycle.run(
              definition,
              request.jobId(),
              params,
              context,
              new ResultGuard(request.warnBytes(), request.maxBytes()));
    } catch (ClassNotFoundException | RuntimeException | LinkageError e) {
      log.error("Cannot load job class {}", request.jobClass(), e);
      JobError fault = ExceptionUtil.toJobError(e);
      outcome = new JobOutcome(null, 0L, fault, false, false, List.of());
    }
    emit(ChildProtocol.Event.outcome(outcome));
    return 0;
  }

  private void readCommands(BufferedReader reader, Thread worker) {
    try {
      String line;
      while ((line = reader.readLine()) != null) {
        if (ChildProtocol.CANCEL.equals(line.trim()) && cancelled.compareAndSet(false, true)) {
          worker.interrupt();
        }
      }
    } catch (IOException e) {
      LoggingService.getLogger(ChildJobRunner.class)
          .debug("Command stream closed: {}", e.toString());
    }
  }

  private synchronized void emit(ChildProtocol.Event event) {
    try {
      protocol.println(mapper.writeValueAsString(event));
      protocol.flush();
    } catch (IOException e) {
      throw new IllegalStateException("Cannot encode " + event.event() + " event", e);
    }
  }
}
