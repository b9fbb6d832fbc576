package com.gentoro.queuemgr;

import com.gentoro.queuemgr.config.ConfigurationProvider;
import com.gentoro.queuemgr.config.QueueMgrSettings;
import com.gentoro.queuemgr.exception.StateException;
import com.gentoro.queuemgr.jobs.ExecutionSupervisor;
import com.gentoro.queuemgr.jobs.RetentionPolicy;
import com.gentoro.queuemgr.logging.LoggingService;
import com.gentoro.queuemgr.registry.RecordCodec;
import com.gentoro.queuemgr.registry.RecoveryReport;
import com.gentoro.queuemgr.registry.RegistryReader;
import com.gentoro.queuemgr.registry.RegistryStore;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Wires the queue manager together: configuration, logging, the registry store, the execution
 * supervisor and the periodic retention cleanup.
 *
 * <p>Typical embedded use:
 *
 * <pre>{@code
 * try (QueueMgr mgr = new QueueMgr(configFile)) {
 *   mgr.initialize();
 *   String id = mgr.supervisor().submit(MyJob.class, null, Map.of("n", 5));
 *   mgr.supervisor().start(id);
 * }
 * }</pre>
 */
public class QueueMgr implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(QueueMgr.class);

  private final Path configFile;
  private ConfigurationProvider configurationProvider;
  private QueueMgrSettings settings;
  private RegistryStore store;
  private ExecutionSupervisor supervisor;
  private ScheduledExecutorService retention;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  /**
   * @param configFile YAML configuration; {@code null} uses {@code queuemgr.yaml} from the class
   *     path
   */
  public QueueMgr(Path configFile) {
    this.configFile = configFile;
  }

  public QueueMgr(String[] applicationArgs) {
    this(configFileFrom(applicationArgs));
  }

  public void initialize() {
    if (store != null) {
      throw new StateException("QueueMgr already initialized");
    }
    this.configurationProvider = new ConfigurationProvider(configFile);
    // logging levels first so the rest of startup honours them
    LoggingService.applyConfiguration(configuration());
    this.settings = QueueMgrSettings.from(configuration());

    this.store = RegistryStore.open(settings.registryPath(), settings.registryFsync());
    RecoveryReport report = store.recoveryReport();
    if (!report.isClean()) {
      log.warn(
          "Registry {} recovered with repairs: {} line(s) rejected, trailing line discarded: {}",
          store.path(),
          report.rejectedLines().size(),
          report.trailingLineDiscarded());
    }

    try {
      this.supervisor = new ExecutionSupervisor(store, settings);
    } catch (RuntimeException e) {
      store.close();
      throw e;
    }

    if (settings.retentionMaxAge() != null) {
      RetentionPolicy policy =
          new RetentionPolicy(settings.retentionMaxAge(), settings.retentionTerminalOnly());
      this.retention =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                Thread t = new Thread(r, "queuemgr-retention");
                t.setDaemon(true);
                return t;
              });
      long interval = settings.retentionInterval().toMillis();
      retention.scheduleWithFixedDelay(
          () -> runRetention(policy), interval, interval, TimeUnit.MILLISECONDS);
      log.info(
          "Retention enabled: removing jobs older than {} every {}",
          settings.retentionMaxAge(),
          settings.retentionInterval());
    }
    log.info("QueueMgr ready ({} job(s) in registry)", store.size());
  }

  private void runRetention(RetentionPolicy policy) {
    try {
      supervisor.cleanup(policy);
    } catch (RuntimeException e) {
      log.error("Retention pass failed", e);
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "queuemgr-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        if (retention != null) {
          retention.shutdownNow();
        }
        closeLogged("supervisor", supervisor);
        closeLogged("registry", store);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  private void closeLogged(String what, AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.error("Failed to close {}", what, e);
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    return initialized(configurationProvider).config();
  }

  public QueueMgrSettings settings() {
    return initialized(settings);
  }

  public RegistryStore store() {
    return initialized(store);
  }

  public ExecutionSupervisor supervisor() {
    return initialized(supervisor);
  }

  /** A lock-free reader over the same registry file, as another process would use it. */
  public RegistryReader reader() {
    return new RegistryReader(
        initialized(store).path(), new RecordCodec(), settings.readRetries());
  }

  private <T> T initialized(T component) {
    if (component == null) {
      throw new StateException("QueueMgr not initialized. Call initialize() first.");
    }
    return component;
  }

  static Path configFileFrom(String[] args) {
    if (args == null) {
      return null;
    }
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg.startsWith("--config=")) {
        return Path.of(StringUtils.substringAfter(arg, "="));
      }
      if ("--config".equals(arg) && i + 1 < args.length) {
        return Path.of(args[i + 1]);
      }
    }
    return null;
  }

  public static void main(String[] args) {
    QueueMgr mgr = new QueueMgr(args);
    mgr.initialize();
    mgr.waitShutdownSignal();
  }
}
