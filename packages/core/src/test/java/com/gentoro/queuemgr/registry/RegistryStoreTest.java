package com.gentoro.queuemgr.registry;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.gentoro.queuemgr.exception.DecodeException;
import com.gentoro.queuemgr.exception.DuplicateJobIdException;
import com.gentoro.queuemgr.exception.JobNotFoundException;
import com.gentoro.queuemgr.exception.StateException;
import com.gentoro.queuemgr.jobs.JobStateMachine;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RegistryStoreTest {
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  @TempDir Path temp;

  private RegistryStore open(Path file) {
    return RegistryStore.open(
        file, new RecordCodec(), Clock.fixed(T0.plusSeconds(60), ZoneOffset.UTC), false);
  }

  private static JobRecord created(String id, int secondsAfterT0) {
    return JobRecord.created(
        id, "test.Job", JsonNodeFactory.instance.objectNode(), T0.plusSeconds(secondsAfterT0));
  }

  private static List<String> lines(Path file) throws Exception {
    return Files.readAllLines(file, StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("opening a missing file creates it, including parent directories")
  void createsFile() {
    Path file = temp.resolve("nested/dir/registry.jsonl");
    try (RegistryStore store = open(file)) {
      assertTrue(Files.exists(file));
      assertEquals(0, store.size());
      assertTrue(store.recoveryReport().isClean());
    }
  }

  @Test
  @DisplayName("every change appends one full line and the latest line wins after reopen")
  void latestLineWins() throws Exception {
    Path file = temp.resolve("registry.jsonl");
    try (RegistryStore store = open(file)) {
      store.append(created("a", 0));
      store.update("a", r -> JobStateMachine.admit(r, T0.plusSeconds(1)));
      store.update("a", r -> JobStateMachine.start(r, T0.plusSeconds(2)));
    }
    assertEquals(3, lines(file).size());

    try (RegistryStore reopened = open(file)) {
      assertEquals(JobStatus.RUNNING, reopened.get("a").orElseThrow().status());
      assertEquals(3, reopened.recoveryReport().recordsLoaded());
    }
  }

  @Test
  @DisplayName("append rejects live and deleted ids")
  void rejectsDuplicateIds() {
    try (RegistryStore store = open(temp.resolve("registry.jsonl"))) {
      store.append(created("a", 0));
      assertThrows(DuplicateJobIdException.class, () -> store.append(created("a", 1)));

      store.update("a", r -> JobStateMachineFixtures.failed(r, T0.plusSeconds(2), "boom"));
      store.delete("a");
      assertTrue(store.get("a").isEmpty());
      assertTrue(store.isKnownId("a"));
      assertThrows(DuplicateJobIdException.class, () -> store.append(created("a", 3)));
    }
  }

  @Test
  @DisplayName("update of an unknown id fails and a mutation returning the same record is a no-op")
  void updateSemantics() throws Exception {
    Path file = temp.resolve("registry.jsonl");
    try (RegistryStore store = open(file)) {
      assertThrows(JobNotFoundException.class, () -> store.update("nope", r -> r));
      store.append(created("a", 0));
      store.update("a", r -> r);
      assertThrows(
          IllegalArgumentException.class,
          () -> store.update("a", r -> created("b", 0)),
          "a mutation must not change the id");
    }
    assertEquals(1, lines(file).size());
  }

  @Test
  @DisplayName("delete rewrites the file with a tombstone that survives reopen")
  void deleteLeavesTombstone() throws Exception {
    Path file = temp.resolve("registry.jsonl");
    try (RegistryStore store = open(file)) {
      store.append(created("a", 0));
      store.append(created("b", 1));
      store.update("a", r -> JobStateMachine.cancel(r, "Job cancelled", T0.plusSeconds(2)));
      long generation = store.generation();

      store.delete("a");

      assertEquals(generation + 1, store.generation());
      assertThrows(JobNotFoundException.class, () -> store.delete("a"));
    }
    List<String> content = lines(file);
    assertEquals(2, content.size());
    assertTrue(content.get(0).contains("\"deleted\":true"));
    assertFalse(content.get(0).contains("params"));

    try (RegistryStore reopened = open(file)) {
      assertEquals(List.of("b"), reopened.list().stream().map(JobRecord::jobId).toList());
      assertTrue(reopened.isKnownId("a"));
    }
  }

  @Test
  @DisplayName("compaction keeps one line per job and shrinks the file")
  void compactShrinksFile() throws Exception {
    Path file = temp.resolve("registry.jsonl");
    try (RegistryStore store = open(file)) {
      for (int i = 0; i < 5; i++) {
        store.append(created("job-" + i, i));
        store.update("job-" + i, r -> JobStateMachine.admit(r, T0.plusSeconds(10)));
        store.update("job-" + i, r -> r.withProgress(50, "half way", T0.plusSeconds(11)));
      }
      long before = store.fileSize();
      List<JobRecord> expected = store.list();

      store.compact();

      assertTrue(store.fileSize() < before);
      assertEquals(expected, store.list());
      assertFalse(Files.exists(temp.resolve("registry.jsonl.compact.tmp")));
      // appends continue on the new file
      store.append(created("late", 20));
    }
    assertEquals(6, lines(file).size());
  }

  @Test
  @DisplayName("compaction keeps tombstones so deleted ids stay reserved")
  void compactKeepsTombstones() throws Exception {
    Path file = temp.resolve("registry.jsonl");
    try (RegistryStore store = open(file)) {
      store.append(created("gone", 0));
      store.update("gone", r -> JobStateMachine.cancel(r, "Job cancelled", T0.plusSeconds(1)));
      store.delete("gone");
      store.append(created("kept", 2));

      store.compact();

      assertTrue(store.isKnownId("gone"));
    }
    assertTrue(lines(file).stream().anyMatch(l -> l.contains("\"deleted\":true")));

    try (RegistryStore reopened = open(file)) {
      assertTrue(reopened.isKnownId("gone"));
      assertTrue(reopened.get("gone").isEmpty());
      assertThrows(DuplicateJobIdException.class, () -> reopened.append(created("gone", 3)));
    }
  }

  @Test
  @DisplayName("list is ordered by creation time, then id")
  void listOrder() {
    try (RegistryStore store = open(temp.resolve("registry.jsonl"))) {
      store.append(created("c", 5));
      store.append(created("b", 1));
      store.append(created("a", 1));

      assertEquals(
          List.of("a", "b", "c"), store.list().stream().map(JobRecord::jobId).toList());
    }
  }

  @Test
  @DisplayName("a truncated last line is discarded on open and the file stays appendable")
  void recoversTruncatedTail() throws Exception {
    Path file = temp.resolve("registry.jsonl");
    try (RegistryStore store = open(file)) {
      store.append(created("a", 0));
      store.append(created("b", 1));
    }
    String full = new RecordCodec().encode(created("c", 2));
    String partial = full.substring(0, full.length() - 7);
    Files.writeString(file, partial, StandardCharsets.UTF_8, StandardOpenOption.APPEND);

    try (RegistryStore store = open(file)) {
      RecoveryReport report = store.recoveryReport();
      assertTrue(report.trailingLineDiscarded());
      assertTrue(report.discardedBytes() > 0);
      assertEquals(2, store.size());
      assertTrue(store.get("c").isEmpty());

      store.append(created("c", 2));
    }
    try (RegistryStore store = open(file)) {
      assertTrue(store.recoveryReport().isClean());
      assertEquals(3, store.size());
    }
  }

  @Test
  @DisplayName("a complete last line without newline is kept and terminated")
  void keepsUnterminatedCompleteLine() throws Exception {
    Path file = temp.resolve("registry.jsonl");
    Files.writeString(file, new RecordCodec().encode(created("a", 0)), StandardCharsets.UTF_8);

    try (RegistryStore store = open(file)) {
      assertEquals(1, store.size());
      store.append(created("b", 1));
    }
    assertEquals(2, lines(file).size());
  }

  @Test
  @DisplayName("corruption before the last line refuses to open")
  void interiorCorruptionIsFatal() throws Exception {
    Path file = temp.resolve("registry.jsonl");
    RecordCodec codec = new RecordCodec();
    Files.writeString(
        file,
        codec.encode(created("a", 0)) + "\n{\"job_id\":\"b\",\n" + codec.encode(created("c", 1))
            + "\n",
        StandardCharsets.UTF_8);

    DecodeException e = assertThrows(DecodeException.class, () -> open(file));
    assertEquals(DecodeException.Kind.CORRUPT, e.getKind());
    assertEquals(2, e.getLineNumber());
  }

  @Test
  @DisplayName("well-formed but invalid interior lines are skipped and reported")
  void skipsInvalidLines() throws Exception {
    Path file = temp.resolve("registry.jsonl");
    RecordCodec codec = new RecordCodec();
    Files.writeString(
        file,
        codec.encode(created("a", 0)) + "\n{\"job_id\":\"\"}\n" + codec.encode(created("c", 1))
            + "\n",
        StandardCharsets.UTF_8);

    try (RegistryStore store = open(file)) {
      assertEquals(2, store.size());
      assertEquals(1, store.recoveryReport().rejectedLines().size());
      assertEquals(2, store.recoveryReport().rejectedLines().get(0).lineNumber());
    }
  }

  @Test
  @DisplayName("writes after close fail")
  void closedStoreRefusesWrites() {
    RegistryStore store = open(temp.resolve("registry.jsonl"));
    store.close();
    assertThrows(StateException.class, () -> store.append(created("a", 0)));
  }

  @Test
  @DisplayName("concurrent writers never interleave lines")
  void concurrentAppends() throws Exception {
    Path file = temp.resolve("registry.jsonl");
    int writers = 8;
    int perWriter = 25;
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    CountDownLatch go = new CountDownLatch(1);
    try (RegistryStore store = open(file)) {
      for (int w = 0; w < writers; w++) {
        final int writer = w;
        pool.submit(
            () -> {
              go.await();
              for (int i = 0; i < perWriter; i++) {
                store.append(created("w" + writer + "-" + i, i));
              }
              return null;
            });
      }
      go.countDown();
      pool.shutdown();
      assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
      assertEquals(writers * perWriter, store.size());
    }
    try (RegistryStore reopened = open(file)) {
      assertTrue(reopened.recoveryReport().isClean());
      assertEquals(writers * perWriter, reopened.size());
    }
  }
}
