package com.gentoro.queuemgr.jobs.isolation;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.queuemgr.config.QueueMgrSettings;
import com.gentoro.queuemgr.jobs.ExecutionSupervisor;
import com.gentoro.queuemgr.jobs.JobDefinition;
import com.gentoro.queuemgr.jobs.JobOutcome;
import com.gentoro.queuemgr.jobs.JobStatusView;
import com.gentoro.queuemgr.jobs.ResultGuard;
import com.gentoro.queuemgr.jobs.TestJobs;
import com.gentoro.queuemgr.registry.JobError;
import com.gentoro.queuemgr.registry.JobStatus;
import com.gentoro.queuemgr.registry.RegistryStore;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcessIsolationTest {
  private static final Duration WAIT = Duration.ofSeconds(60);

  @TempDir Path temp;

  private RegistryStore store;
  private ExecutionSupervisor supervisor;

  private ExecutionSupervisor start(QueueMgrSettings.Builder builder) {
    QueueMgrSettings s =
        builder
            .registryPath(temp.resolve("registry.jsonl"))
            .registryFsync(false)
            .isolation(QueueMgrSettings.ISOLATION_PROCESS)
            .cancelGrace(Duration.ofSeconds(2))
            .shutdownTimeout(Duration.ofSeconds(2))
            .build();
    store = RegistryStore.open(s.registryPath(), false);
    supervisor = new ExecutionSupervisor(store, s);
    return supervisor;
  }

  @AfterEach
  void tearDown() {
    if (supervisor != null) supervisor.close();
    if (store != null) store.close();
  }

  private JobStatusView run(String id) throws InterruptedException {
    supervisor.start(id);
    return supervisor.awaitTerminal(id, WAIT);
  }

  @Test
  @DisplayName("the child command runs the job runner on the same class path")
  void command() {
    ProcessIsolation isolation = new ProcessIsolation(List.of("-Xmx64m"), "a.jar:b.jar");

    List<String> cmd = isolation.command();

    assertTrue(cmd.get(0).endsWith("java"));
    assertEquals(
        List.of("-Xmx64m", "-cp", "a.jar:b.jar", ChildJobRunner.class.getName()),
        cmd.subList(1, cmd.size()));
  }

  @Test
  @DisplayName("outcome and progress events travel back from the child")
  void reportsOutcomeAndProgress() throws Exception {
    List<Integer> progress = new CopyOnWriteArrayList<>();
    JobLaunch launch =
        new JobLaunch(
            JobDefinition.of(TestJobs.SleepingJob.class),
            "direct",
            Map.of("millis", 200),
            new ResultGuard(1024, 4096),
            (percent, description) -> progress.add(percent));

    ExecutionHandle handle = new ProcessIsolation().launch(launch);
    JobOutcome outcome = handle.outcome().get(60, TimeUnit.SECONDS);

    assertTrue(outcome.isSuccess(), () -> "unexpected fault " + outcome.fault());
    assertEquals("slept", outcome.result().asText());
    assertFalse(progress.isEmpty());
  }

  @Test
  @DisplayName("a job runs to completion in a child process")
  void completesInChild() throws Exception {
    start(QueueMgrSettings.builder());
    String id = supervisor.submit(TestJobs.SumJob.class, "child-sum", Map.of("n", 5));

    JobStatusView view = run(id);

    assertEquals(JobStatus.COMPLETED, view.status());
    assertEquals(15, view.result().get("sum").asInt());
  }

  @Test
  @DisplayName("an exception in the child is recorded like an in-process failure")
  void failureInChild() throws Exception {
    start(QueueMgrSettings.builder());
    String id = supervisor.submit(TestJobs.FailingJob.class, "child-fail", Map.of());

    JobStatusView view = run(id);

    assertEquals(JobStatus.FAILED, view.status());
    assertEquals("IllegalStateException", view.error().kind());
    assertEquals("boom", view.error().message());
  }

  @Test
  @DisplayName("a child that dies without an outcome fails the job")
  void childCrash() throws Exception {
    start(QueueMgrSettings.builder());
    String id = supervisor.submit(TestJobs.ExitingJob.class, "child-crash", Map.of());

    JobStatusView view = run(id);

    assertEquals(JobStatus.FAILED, view.status());
    assertEquals(ProcessIsolation.KIND_PROCESS_EXITED, view.error().kind());
    assertTrue(view.error().message().contains("code 3"), view.error().message());
  }

  @Test
  @DisplayName("a child that ignores cancellation is terminated on timeout")
  void terminatesOnTimeout() throws Exception {
    start(
        QueueMgrSettings.builder()
            .jobTimeout(Duration.ofSeconds(3))
            .cancelGrace(Duration.ofMillis(500)));
    String id = supervisor.submit(TestJobs.StubbornJob.class, "child-stuck", Map.of());

    JobStatusView view = run(id);

    assertEquals(JobStatus.FAILED, view.status());
    assertEquals(JobError.KIND_TIMEOUT, view.error().kind());
  }

  @Test
  @DisplayName("cancellation is delivered to the child")
  void cancelsChild() throws Exception {
    start(QueueMgrSettings.builder());
    String id =
        supervisor.submit(TestJobs.SleepingJob.class, "child-cancel", Map.of("millis", 30_000));
    supervisor.start(id);
    long end = System.currentTimeMillis() + WAIT.toMillis();
    while (supervisor.getStatus(id).progress() == 0 && System.currentTimeMillis() < end) {
      Thread.sleep(50);
    }

    supervisor.cancel(id);

    assertEquals(JobStatus.CANCELLED, supervisor.awaitTerminal(id, WAIT).status());
  }

  @Test
  @DisplayName("factory-only definitions cannot run in a child process")
  void rejectsFactoryDefinitions() {
    start(QueueMgrSettings.builder());
    JobDefinition factoryOnly = JobDefinition.of("inline", (id, p) -> context -> "x");

    assertThrows(IllegalArgumentException.class, () -> supervisor.register(factoryOnly));
    assertThrows(
        IllegalArgumentException.class, () -> supervisor.submit(factoryOnly, "inline", null));
  }
}
