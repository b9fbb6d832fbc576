package com.gentoro.queuemgr.jobs;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.queuemgr.exception.InvalidTransitionException;
import com.gentoro.queuemgr.registry.JobError;
import com.gentoro.queuemgr.registry.JobRecord;
import com.gentoro.queuemgr.registry.JobStatus;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class JobStateMachineTest {
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private static JobRecord created() {
    return JobRecord.created("j", "t", JsonNodeFactory.instance.objectNode(), T0);
  }

  @Test
  @DisplayName("allowed edges follow the job lifecycle")
  void edges() {
    assertEquals(
        EnumSet.of(JobStatus.QUEUED, JobStatus.CANCELLED),
        JobStateMachine.successors(JobStatus.CREATED));
    assertEquals(
        EnumSet.of(JobStatus.RUNNING, JobStatus.CANCELLED),
        JobStateMachine.successors(JobStatus.QUEUED));
    assertEquals(
        EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED),
        JobStateMachine.successors(JobStatus.RUNNING));
    assertFalse(JobStateMachine.canTransition(JobStatus.CREATED, JobStatus.RUNNING));
    assertFalse(JobStateMachine.canTransition(JobStatus.QUEUED, JobStatus.COMPLETED));
  }

  @ParameterizedTest
  @EnumSource(
      value = JobStatus.class,
      names = {"COMPLETED", "FAILED", "CANCELLED"})
  @DisplayName("terminal states have no successors")
  void terminalStatesAreFinal(JobStatus terminal) {
    assertTrue(terminal.isTerminal());
    Set<JobStatus> next = JobStateMachine.successors(terminal);
    assertTrue(next.isEmpty());
  }

  @Test
  @DisplayName("happy path keeps timestamps monotonic and stores the result")
  void happyPath() {
    JobRecord queued = JobStateMachine.admit(created(), T0.plusSeconds(1));
    JobRecord running = JobStateMachine.start(queued, T0.plusSeconds(2));
    JobRecord done =
        JobStateMachine.complete(running, TextNode.valueOf("ok"), 5, T0.plusSeconds(3));

    assertEquals(JobStatus.COMPLETED, done.status());
    assertEquals(100, done.progress());
    assertEquals("ok", done.result().asText());
    assertEquals(5, done.sizeBytes());
    assertEquals(T0, done.createdAt());
    assertEquals(T0.plusSeconds(3), done.updatedAt());
    assertTrue(done.invariantViolation().isEmpty());
  }

  @Test
  @DisplayName("a clock going backwards never moves updated_at back")
  void timestampsNeverGoBack() {
    JobRecord queued = JobStateMachine.admit(created(), T0.minusSeconds(30));
    assertEquals(T0, queued.updatedAt());
  }

  @Test
  @DisplayName("fail stores the error and no result")
  void fail() {
    JobRecord running =
        JobStateMachine.start(JobStateMachine.admit(created(), T0), T0.plusSeconds(1));
    JobRecord failed =
        JobStateMachine.fail(running, JobError.of("IllegalStateException", "boom"), T0);

    assertEquals(JobStatus.FAILED, failed.status());
    assertEquals("boom", failed.error().message());
    assertNull(failed.result());
  }

  @Test
  @DisplayName("illegal moves are rejected with both states named")
  void illegalMoves() {
    InvalidTransitionException e =
        assertThrows(
            InvalidTransitionException.class,
            () -> JobStateMachine.start(created(), T0.plusSeconds(1)));
    assertEquals("CREATED", e.getFrom());
    assertEquals("RUNNING", e.getTo());

    JobRecord cancelled = JobStateMachine.cancel(created(), "Job cancelled", T0);
    assertThrows(InvalidTransitionException.class, () -> JobStateMachine.admit(cancelled, T0));
    assertThrows(
        InvalidTransitionException.class,
        () -> JobStateMachine.cancel(cancelled, "again", T0));
  }
}
