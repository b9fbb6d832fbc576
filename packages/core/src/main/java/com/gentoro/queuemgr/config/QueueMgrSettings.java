package com.gentoro.queuemgr.config;

import com.gentoro.queuemgr.exception.ConfigurationException;
import com.gentoro.queuemgr.jobs.ResultGuard;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Typed view of the configuration keys the queue manager understands.
 *
 * <p>Durations use ISO-8601 notation ({@code PT30S}). A {@code null} {@link #jobTimeout()} or
 * {@link #retentionMaxAge()} disables the feature; a {@link #maxJobs()} of zero means unlimited.
 */
public record QueueMgrSettings(
    Path registryPath,
    boolean registryFsync,
    int readRetries,
    long resultWarnBytes,
    long resultMaxBytes,
    int maxConcurrentJobs,
    boolean autoStart,
    String isolation,
    Duration jobTimeout,
    Duration cancelGrace,
    Duration shutdownTimeout,
    int maxJobs,
    Map<String, Integer> typeLimits,
    Duration retentionMaxAge,
    Duration retentionInterval,
    boolean retentionTerminalOnly,
    List<String> processJavaOptions) {

  public static final String ISOLATION_THREAD = "thread";
  public static final String ISOLATION_PROCESS = "process";

  public QueueMgrSettings {
    typeLimits = Map.copyOf(typeLimits);
    processJavaOptions = List.copyOf(processJavaOptions);
    validate(
        registryPath,
        readRetries,
        resultWarnBytes,
        resultMaxBytes,
        maxConcurrentJobs,
        isolation,
        maxJobs,
        typeLimits);
    requireNonNegative("supervisor.job-timeout", jobTimeout);
    requireNonNegative("supervisor.cancel-grace", cancelGrace);
    requireNonNegative("supervisor.shutdown-timeout", shutdownTimeout);
    requireNonNegative("retention.max-age", retentionMaxAge);
    requireNonNegative("retention.interval", retentionInterval);
    if (cancelGrace == null || shutdownTimeout == null || retentionInterval == null) {
      throw new ConfigurationException(
          "supervisor.cancel-grace, supervisor.shutdown-timeout and retention.interval are"
              + " required");
    }
  }

  public static QueueMgrSettings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .registryPath(registryPath)
        .registryFsync(registryFsync)
        .readRetries(readRetries)
        .resultWarnBytes(resultWarnBytes)
        .resultMaxBytes(resultMaxBytes)
        .maxConcurrentJobs(maxConcurrentJobs)
        .autoStart(autoStart)
        .isolation(isolation)
        .jobTimeout(jobTimeout)
        .cancelGrace(cancelGrace)
        .shutdownTimeout(shutdownTimeout)
        .maxJobs(maxJobs)
        .typeLimits(typeLimits)
        .retentionMaxAge(retentionMaxAge)
        .retentionInterval(retentionInterval)
        .retentionTerminalOnly(retentionTerminalOnly)
        .processJavaOptions(processJavaOptions);
  }

  /** Read settings from {@code config}, falling back to the defaults for absent keys. */
  public static QueueMgrSettings from(Configuration config) {
    QueueMgrSettings d = defaults();
    try {
      return builder()
          .registryPath(Path.of(config.getString("registry.path", d.registryPath().toString())))
          .registryFsync(config.getBoolean("registry.fsync", d.registryFsync()))
          .readRetries(config.getInt("registry.read-retries", d.readRetries()))
          .resultWarnBytes(config.getLong("result.warn-bytes", d.resultWarnBytes()))
          .resultMaxBytes(config.getLong("result.max-bytes", d.resultMaxBytes()))
          .maxConcurrentJobs(
              config.getInt("supervisor.max-concurrent-jobs", d.maxConcurrentJobs()))
          .autoStart(config.getBoolean("supervisor.auto-start", d.autoStart()))
          .isolation(config.getString("supervisor.isolation", d.isolation()))
          .jobTimeout(duration(config, "supervisor.job-timeout", d.jobTimeout()))
          .cancelGrace(duration(config, "supervisor.cancel-grace", d.cancelGrace()))
          .shutdownTimeout(duration(config, "supervisor.shutdown-timeout", d.shutdownTimeout()))
          .maxJobs(config.getInt("supervisor.max-jobs", d.maxJobs()))
          .typeLimits(typeLimits(config))
          .retentionMaxAge(duration(config, "retention.max-age", d.retentionMaxAge()))
          .retentionInterval(duration(config, "retention.interval", d.retentionInterval()))
          .retentionTerminalOnly(
              config.getBoolean("retention.terminal-only", d.retentionTerminalOnly()))
          .processJavaOptions(config.getList(String.class, "process.java-options", List.of()))
          .build();
    } catch (org.apache.commons.configuration2.ex.ConversionException e) {
      throw new ConfigurationException("Invalid configuration value: " + e.getMessage(), e);
    }
  }

  private static Duration duration(Configuration config, String key, Duration fallback) {
    String raw = config.getString(key, null);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Duration.parse(raw.trim());
    } catch (DateTimeParseException e) {
      throw new ConfigurationException(
          "Invalid duration for " + key + ": '" + raw + "' (expected ISO-8601, e.g. PT30S)", e);
    }
  }

  private static Map<String, Integer> typeLimits(Configuration config) {
    Map<String, Integer> limits = new LinkedHashMap<>();
    Configuration subset = config.subset("supervisor.type-limits");
    for (Iterator<String> it = subset.getKeys(); it.hasNext(); ) {
      String key = it.next();
      // hierarchical configurations escape dots inside a single YAML key
      limits.put(key.replace("..", "."), subset.getInt(key));
    }
    return limits;
  }

  private static void validate(
      Path registryPath,
      int readRetries,
      long warnBytes,
      long maxBytes,
      int maxConcurrentJobs,
      String isolation,
      int maxJobs,
      Map<String, Integer> typeLimits) {
    if (registryPath == null) {
      throw new ConfigurationException("registry.path is required");
    }
    if (readRetries < 0) {
      throw new ConfigurationException("registry.read-retries must not be negative");
    }
    if (maxBytes <= 0 || warnBytes < 0 || warnBytes > maxBytes) {
      throw new ConfigurationException(
          "result.warn-bytes must be between 0 and result.max-bytes, which must be positive");
    }
    if (maxConcurrentJobs < 1) {
      throw new ConfigurationException("supervisor.max-concurrent-jobs must be at least 1");
    }
    if (!ISOLATION_THREAD.equals(isolation) && !ISOLATION_PROCESS.equals(isolation)) {
      throw new ConfigurationException(
          "supervisor.isolation must be 'thread' or 'process', got '" + isolation + "'");
    }
    if (maxJobs < 0) {
      throw new ConfigurationException("supervisor.max-jobs must not be negative");
    }
    typeLimits.forEach(
        (type, limit) -> {
          if (limit == null || limit < 1) {
            throw new ConfigurationException(
                "supervisor.type-limits." + type + " must be at least 1");
          }
        });
  }

  private static void requireNonNegative(String key, Duration value) {
    if (value != null && value.isNegative()) {
      throw new ConfigurationException(key + " must not be negative");
    }
  }

  /** Mutable builder, mostly for programmatic setup and tests. */
  public static final class Builder {
    private Path registryPath = Path.of("queuemgr_registry.jsonl");
    private boolean registryFsync = true;
    private int readRetries = 3;
    private long resultWarnBytes = ResultGuard.DEFAULT_WARN_BYTES;
    private long resultMaxBytes = ResultGuard.DEFAULT_MAX_BYTES;
    private int maxConcurrentJobs = 10;
    private boolean autoStart;
    private String isolation = ISOLATION_THREAD;
    private Duration jobTimeout;
    private Duration cancelGrace = Duration.ofSeconds(5);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private int maxJobs;
    private Map<String, Integer> typeLimits = Map.of();
    private Duration retentionMaxAge;
    private Duration retentionInterval = Duration.ofSeconds(60);
    private boolean retentionTerminalOnly = true;
    private List<String> processJavaOptions = List.of();

    private Builder() {}

    public Builder registryPath(Path registryPath) {
      this.registryPath = registryPath;
      return this;
    }

    public Builder registryFsync(boolean registryFsync) {
      this.registryFsync = registryFsync;
      return this;
    }

    public Builder readRetries(int readRetries) {
      this.readRetries = readRetries;
      return this;
    }

    public Builder resultWarnBytes(long resultWarnBytes) {
      this.resultWarnBytes = resultWarnBytes;
      return this;
    }

    public Builder resultMaxBytes(long resultMaxBytes) {
      this.resultMaxBytes = resultMaxBytes;
      return this;
    }

    public Builder maxConcurrentJobs(int maxConcurrentJobs) {
      this.maxConcurrentJobs = maxConcurrentJobs;
      return this;
    }

    public Builder autoStart(boolean autoStart) {
      this.autoStart = autoStart;
      return this;
    }

    public Builder isolation(String isolation) {
      this.isolation = isolation;
      return this;
    }

    public Builder jobTimeout(Duration jobTimeout) {
      this.jobTimeout = jobTimeout;
      return this;
    }

    public Builder cancelGrace(Duration cancelGrace) {
      this.cancelGrace = cancelGrace;
      return this;
    }

    public Builder shutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    public Builder maxJobs(int maxJobs) {
      this.maxJobs = maxJobs;
      return this;
    }

    public Builder typeLimits(Map<String, Integer> typeLimits) {
      this.typeLimits = typeLimits;
      return this;
    }

    public Builder retentionMaxAge(Duration retentionMaxAge) {
      this.retentionMaxAge = retentionMaxAge;
      return this;
    }

    public Builder retentionInterval(Duration retentionInterval) {
      this.retentionInterval = retentionInterval;
      return this;
    }

    public Builder retentionTerminalOnly(boolean retentionTerminalOnly) {
      this.retentionTerminalOnly = retentionTerminalOnly;
      return this;
    }

    public Builder processJavaOptions(List<String> processJavaOptions) {
      this.processJavaOptions = processJavaOptions;
      return this;
    }

    public QueueMgrSettings build() {
      return new QueueMgrSettings(
          registryPath,
          registryFsync,
          readRetries,
          resultWarnBytes,
          resultMaxBytes,
          maxConcurrentJobs,
          autoStart,
          isolation,
          jobTimeout,
          cancelGrace,
          shutdownTimeout,
          maxJobs,
          typeLimits,
          retentionMaxAge,
          retentionInterval,
          retentionTerminalOnly,
          processJavaOptions);
    }
  }
}
