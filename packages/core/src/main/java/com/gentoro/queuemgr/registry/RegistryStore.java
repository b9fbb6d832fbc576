package com.gentoro.queuemgr.registry;

import com.gentoro.queuemgr.exception.DecodeException;
import com.gentoro.queuemgr.exception.DuplicateJobIdException;
import com.gentoro.queuemgr.exception.JobNotFoundException;
import com.gentoro.queuemgr.exception.StateException;
import com.gentoro.queuemgr.exception.StorageException;
import com.gentoro.queuemgr.logging.LoggingService;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;

/**
 * Append-structured, crash-tolerant store of {@link JobRecord}s.
 *
 * <p>Every mutation appends one line holding the complete new state of a record; the most recent
 * line for a job id wins. An in-memory index mirrors the latest state so that {@link #get} and
 * {@link #list} never touch the disk and never take the write lock.
 *
 * <p>Mutations ({@link #append}, {@link #update}, {@link #delete}, {@link #compact}) are strictly
 * serialized. The store supports a single writing owner; other processes only read the file (see
 * {@link RegistryReader}).
 *
 * <p>{@link #compact()} and deletions rewrite the file through a temporary sibling and an atomic
 * rename, so the original file stays valid until the replacement is complete. Deleted ids are kept
 * as tombstone lines and can never be reused.
 */
public final class RegistryStore implements Closeable {
  private static final Logger log = LoggingService.getLogger(RegistryStore.class);

  static final Comparator<JobRecord> CREATION_ORDER =
      Comparator.comparing(JobRecord::createdAt).thenComparing(JobRecord::jobId);

  private final Path path;
  private final RecordCodec codec;
  private final Clock clock;
  private final boolean fsync;
  private final ReentrantLock writeLock = new ReentrantLock();

  private volatile Map<String, JobRecord> index = new ConcurrentHashMap<>();
  private volatile Map<String, JobRecord> tombstones = new ConcurrentHashMap<>();
  private volatile long generation;
  private volatile boolean failed;
  private volatile boolean closed;
  private FileChannel channel;
  private RecoveryReport recoveryReport;

  private RegistryStore(Path path, RecordCodec codec, Clock clock, boolean fsync) {
    this.path = path.toAbsolutePath();
    this.codec = codec;
    this.clock = clock;
    this.fsync = fsync;
  }

  /** Open (or create) the registry at {@code path} and recover its contents. */
  public static RegistryStore open(Path path, boolean fsync) {
    return open(path, new RecordCodec(), Clock.systemUTC(), fsync);
  }

  public static RegistryStore open(Path path, RecordCodec codec, Clock clock, boolean fsync) {
    RegistryStore store = new RegistryStore(path, codec, clock, fsync);
    store.recover();
    return store;
  }

  // --------------------------------------------------------------------
  // Reads (lock-free)
  // --------------------------------------------------------------------

  public Optional<JobRecord> get(String jobId) {
    return Optional.ofNullable(index.get(jobId));
  }

  /** Point-in-time copy of all live records ordered by creation time, then job id. */
  public List<JobRecord> list() {
    List<JobRecord> records = new ArrayList<>(index.values());
    records.sort(CREATION_ORDER);
    return records;
  }

  /** Whether the id is live or was ever deleted. */
  public boolean isKnownId(String jobId) {
    return index.containsKey(jobId) || tombstones.containsKey(jobId);
  }

  public int size() {
    return index.size();
  }

  public Path path() {
    return path;
  }

  /** Incremented by every successful rewrite of the file. */
  public long generation() {
    return generation;
  }

  public RecoveryReport recoveryReport() {
    return recoveryReport;
  }

  /** Current size of the registry file in bytes. */
  public long fileSize() {
    try {
      return Files.size(path);
    } catch (IOException e) {
      throw new StorageException("Cannot stat registry " + path, e);
    }
  }

  // --------------------------------------------------------------------
  // Writes (serialized)
  // --------------------------------------------------------------------

  /** Persist a new record. Fails with {@link DuplicateJobIdException} for a known id. */
  public void append(JobRecord record) {
    requireValid(record);
    writeLock.lock();
    try {
      ensureWritable();
      if (isKnownId(record.jobId())) {
        throw new DuplicateJobIdException(record.jobId());
      }
      writeLine(record);
      index.put(record.jobId(), record);
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Apply {@code mutation} to the current record and persist the outcome. Returning the same
   * instance from the mutation is a no-op. Exceptions thrown by the mutation propagate and leave
   * the record untouched.
   */
  public JobRecord update(String jobId, UnaryOperator<JobRecord> mutation) {
    writeLock.lock();
    try {
      ensureWritable();
      JobRecord current = index.get(jobId);
      if (current == null) {
        throw new JobNotFoundException(jobId);
      }
      JobRecord next = mutation.apply(current);
      if (next == null || next == current) {
        return current;
      }
      if (!jobId.equals(next.jobId())) {
        throw new IllegalArgumentException(
            "Mutation changed job id from '" + jobId + "' to '" + next.jobId() + "'");
      }
      requireValid(next);
      writeLine(next);
      index.put(jobId, next);
      return next;
    } finally {
      writeLock.unlock();
    }
  }

  /** Remove a record; the registry is rewritten without it and the id stays reserved. */
  public void delete(String jobId) {
    deleteAll(List.of(jobId));
  }

  /**
   * Remove several records with a single rewrite.
   *
   * @return number of records removed
   */
  public int deleteAll(Collection<String> jobIds) {
    writeLock.lock();
    try {
      ensureWritable();
      Set<String> ids = new LinkedHashSet<>(jobIds);
      for (String id : ids) {
        if (!index.containsKey(id)) {
          throw new JobNotFoundException(id);
        }
      }
      if (ids.isEmpty()) {
        return 0;
      }
      Map<String, JobRecord> live = new HashMap<>(index);
      Map<String, JobRecord> dead = new HashMap<>(tombstones);
      for (String id : ids) {
        dead.put(id, live.remove(id).toTombstone(clock.instant()));
      }
      rewrite(live, dead);
      log.debug("Deleted {} record(s) from {}", ids.size(), path);
      return ids.size();
    } finally {
      writeLock.unlock();
    }
  }

  /** Rewrite the file keeping only the latest line per job (and one tombstone per deleted id). */
  public void compact() {
    writeLock.lock();
    try {
      ensureWritable();
      long before = fileSize();
      rewrite(new HashMap<>(index), new HashMap<>(tombstones));
      log.info(
          "Compacted registry {} ({} -> {} bytes, generation {})",
          path,
          before,
          fileSize(),
          generation);
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public void close() {
    writeLock.lock();
    try {
      if (closed) return;
      closed = true;
      closeChannel();
    } finally {
      writeLock.unlock();
    }
  }

  // --------------------------------------------------------------------
  // Internals
  // --------------------------------------------------------------------

  private void recover() {
    try {
      Path parent = path.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      if (!Files.exists(path)) {
        Files.createFile(path);
      }
    } catch (IOException e) {
      throw new StorageException("Cannot create registry " + path, e);
    }

    long linesRead = 0;
    long loaded = 0;
    long truncateAt = -1;
    boolean needsNewline = false;
    List<RecoveryReport.RejectedLine> rejected = new ArrayList<>();
    Map<String, JobRecord> live = new ConcurrentHashMap<>();
    Map<String, JobRecord> dead = new ConcurrentHashMap<>();

    try (RegistryLineScanner scanner = new RegistryLineScanner(path)) {
      RegistryLineScanner.Line line;
      while ((line = scanner.next()) != null) {
        linesRead++;
        boolean last = !scanner.hasMore();
        if (line.text().isBlank()) {
          continue;
        }
        JobRecord record;
        try {
          record = codec.decode(line.text());
        } catch (DecodeException e) {
          boolean partialTail = last && !line.terminated();
          if (e.getKind() == DecodeException.Kind.CORRUPT && last || partialTail) {
            log.warn(
                "Discarding interrupted write at line {} of {}: {}",
                line.number(),
                path,
                e.getMessage());
            truncateAt = line.offset();
            break;
          }
          if (e.getKind() == DecodeException.Kind.CORRUPT) {
            throw e.atLine(line.number());
          }
          log.warn(
              "Skipping invalid record at line {} of {}: {}", line.number(), path, e.getMessage());
          rejected.add(new RecoveryReport.RejectedLine(line.number(), e.getMessage()));
          continue;
        }
        loaded++;
        if (record.deleted()) {
          live.remove(record.jobId());
          dead.put(record.jobId(), record);
        } else if (!dead.containsKey(record.jobId())) {
          live.put(record.jobId(), record);
        }
        needsNewline = last && !line.terminated();
      }
    } catch (IOException e) {
      throw new StorageException("Cannot read registry " + path, e);
    }

    long discarded = 0;
    try {
      channel = FileChannel.open(path, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
      if (truncateAt >= 0) {
        discarded = channel.size() - truncateAt;
        channel.truncate(truncateAt);
        channel.force(true);
      } else if (needsNewline) {
        write(channel, "\n");
      }
    } catch (IOException e) {
      closeChannel();
      throw new StorageException("Cannot repair registry " + path, e);
    }

    this.index = live;
    this.tombstones = dead;
    this.recoveryReport =
        new RecoveryReport(linesRead, loaded, truncateAt >= 0, discarded, List.copyOf(rejected));
    log.info(
        "Opened registry {}: {} live record(s), {} tombstone(s), {} line(s)",
        path,
        live.size(),
        dead.size(),
        linesRead);
  }

  private void writeLine(JobRecord record) {
    String line = codec.encode(record) + "\n";
    long position;
    try {
      position = channel.size();
    } catch (IOException e) {
      throw new StorageException("Cannot append to registry " + path, e);
    }
    try {
      write(channel, line);
    } catch (IOException e) {
      rollback(position, e);
      throw new StorageException("Failed to append record " + record.jobId() + " to " + path, e);
    }
  }

  private void write(FileChannel target, String text) throws IOException {
    ByteBuffer buf = ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8));
    while (buf.hasRemaining()) {
      target.write(buf);
    }
    if (fsync) {
      target.force(false);
    }
  }

  /** Cut a partially written line; if that fails the store refuses further writes. */
  private void rollback(long position, IOException cause) {
    try {
      channel.truncate(position);
    } catch (IOException e) {
      failed = true;
      cause.addSuppressed(e);
      log.error("Registry {} left in an unknown state, further writes are refused", path, e);
    }
  }

  private void rewrite(Map<String, JobRecord> live, Map<String, JobRecord> dead) {
    Path tmp = path.resolveSibling(path.getFileName() + ".compact.tmp");
    List<JobRecord> ordered = new ArrayList<>(dead.values());
    ordered.sort(CREATION_ORDER);
    List<JobRecord> liveOrdered = new ArrayList<>(live.values());
    liveOrdered.sort(CREATION_ORDER);
    ordered.addAll(liveOrdered);

    try (FileChannel out =
        FileChannel.open(
            tmp,
            StandardOpenOption.CREATE,
            StandardOpenOption.WRITE,
            StandardOpenOption.TRUNCATE_EXISTING)) {
      StringBuilder sb = new StringBuilder();
      for (JobRecord r : ordered) {
        sb.append(codec.encode(r)).append('\n');
        if (sb.length() >= 64 * 1024) {
          writeFully(out, sb);
        }
      }
      writeFully(out, sb);
      out.force(true);
    } catch (IOException e) {
      deleteQuietly(tmp);
      throw new StorageException("Failed to write compacted registry " + tmp, e);
    }

    try {
      Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      deleteQuietly(tmp);
      throw new StorageException("File system does not support atomic rename for " + path, e);
    } catch (IOException e) {
      deleteQuietly(tmp);
      throw new StorageException("Failed to replace registry " + path, e);
    }

    closeChannel();
    try {
      channel = FileChannel.open(path, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    } catch (IOException e) {
      failed = true;
      throw new StorageException("Cannot reopen registry " + path + " after rewrite", e);
    }
    Map<String, JobRecord> newIndex = new ConcurrentHashMap<>(live);
    Map<String, JobRecord> newTombstones = new ConcurrentHashMap<>(dead);
    this.index = newIndex;
    this.tombstones = newTombstones;
    generation++;
  }

  private static void writeFully(FileChannel out, StringBuilder sb) throws IOException {
    ByteBuffer buf = ByteBuffer.wrap(sb.toString().getBytes(StandardCharsets.UTF_8));
    while (buf.hasRemaining()) {
      out.write(buf);
    }
    sb.setLength(0);
  }

  private void deleteQuietly(Path tmp) {
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.warn("Could not remove temporary file {}", tmp, e);
    }
  }

  private void closeChannel() {
    if (channel == null) return;
    try {
      channel.close();
    } catch (IOException e) {
      log.warn("Error closing registry channel {}", path, e);
    } finally {
      channel = null;
    }
  }

  private void ensureWritable() {
    if (closed) {
      throw new StateException("Registry " + path + " is closed");
    }
    if (failed) {
      throw new StorageException("Registry " + path + " refused write after an I/O failure");
    }
  }

  private static void requireValid(JobRecord record) {
    String violation = record.invariantViolation().orElse(null);
    if (violation != null) {
      throw new IllegalArgumentException(
          "Refusing to persist invalid record '" + record.jobId() + "': " + violation);
    }
  }
}
