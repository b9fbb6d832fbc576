package com.gentoro.queuemgr.registry;

import com.gentoro.queuemgr.exception.DecodeException;
import com.gentoro.queuemgr.exception.StorageException;
import com.gentoro.queuemgr.logging.LoggingService;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Read-only view of a registry file for consumers outside the supervising process (CLI, web
 * frontends, other tools).
 *
 * <p>Readers take no locks and never block the writer. Each call opens the file once and decodes it
 * line by line; since the writer only ever appends whole lines or atomically renames a complete
 * replacement into place, every decoded record is one full state, possibly one update behind. An
 * unterminated last line is a write in progress and is ignored.
 */
public final class RegistryReader {
  private static final Logger log = LoggingService.getLogger(RegistryReader.class);

  private final Path path;
  private final RecordCodec codec;
  private final int attempts;

  public RegistryReader(Path path) {
    this(path, new RecordCodec(), 3);
  }

  /**
   * @param retries extra attempts after an I/O failure; reads are idempotent so retrying is safe
   */
  public RegistryReader(Path path, RecordCodec codec, int retries) {
    this.path = path.toAbsolutePath();
    this.codec = codec;
    this.attempts = Math.max(1, retries + 1);
  }

  public Path path() {
    return path;
  }

  /** Decode the current durable state. A missing file yields an empty snapshot. */
  public Snapshot snapshot() {
    IOException last = null;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        return scan();
      } catch (NoSuchFileException e) {
        return new Snapshot(Map.of(), Instant.now());
      } catch (IOException e) {
        last = e;
        log.debug("Read attempt {} of {} failed for {}", attempt, attempts, path, e);
      }
    }
    throw new StorageException("Cannot read registry " + path, last);
  }

  public List<JobRecord> list() {
    return snapshot().list();
  }

  public Optional<JobRecord> get(String jobId) {
    return snapshot().get(jobId);
  }

  private Snapshot scan() throws IOException {
    Map<String, JobRecord> latest = new HashMap<>();
    Set<String> deleted = new HashSet<>();
    try (RegistryLineScanner scanner = new RegistryLineScanner(path)) {
      RegistryLineScanner.Line line;
      while ((line = scanner.next()) != null) {
        if (!line.terminated() || line.text().isBlank()) {
          continue;
        }
        JobRecord record;
        try {
          record = codec.decode(line.text());
        } catch (DecodeException e) {
          if (e.getKind() == DecodeException.Kind.CORRUPT) {
            if (!scanner.hasMore()) {
              // remnant of a crashed append that the writer has not repaired yet
              continue;
            }
            throw e.atLine(line.number());
          }
          log.debug("Ignoring invalid record at line {} of {}", line.number(), path);
          continue;
        }
        if (record.deleted()) {
          deleted.add(record.jobId());
          latest.remove(record.jobId());
        } else if (!deleted.contains(record.jobId())) {
          latest.put(record.jobId(), record);
        }
      }
    }
    return new Snapshot(latest, Instant.now());
  }

  /** Immutable point-in-time copy of the registry contents. */
  public static final class Snapshot {
    private final Map<String, JobRecord> records;
    private final Instant takenAt;

    Snapshot(Map<String, JobRecord> records, Instant takenAt) {
      this.records = Collections.unmodifiableMap(new HashMap<>(records));
      this.takenAt = takenAt;
    }

    public Optional<JobRecord> get(String jobId) {
      return Optional.ofNullable(records.get(jobId));
    }

    /** Records ordered by creation time, then job id. */
    public List<JobRecord> list() {
      List<JobRecord> out = new ArrayList<>(records.values());
      out.sort(RegistryStore.CREATION_ORDER);
      return out;
    }

    public List<JobRecord> list(JobStatus status) {
      return list().stream().filter(r -> r.status() == status).toList();
    }

    public int size() {
      return records.size();
    }

    public Instant takenAt() {
      return takenAt;
    }
  }
}
