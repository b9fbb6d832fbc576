package com.gentoro.queuemgr.jobs;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import java.util.Objects;

/**
 * Names a kind of job and knows how to instantiate it.
 *
 * <p>Definitions built from a class ({@link #of(Class)}) use the fully qualified class name as job
 * type and can run in any isolation mode, including child processes. Factory-based definitions
 * ({@link #of(String, JobFactory)}) only work with in-process isolation.
 */
public final class JobDefinition {
  private final String jobType;
  private final Class<? extends QueueJob> jobClass;
  private final JobFactory factory;

  private JobDefinition(String jobType, Class<? extends QueueJob> jobClass, JobFactory factory) {
    if (jobType == null || jobType.isBlank()) {
      throw new IllegalArgumentException("jobType must not be blank");
    }
    this.jobType = jobType;
    this.jobClass = jobClass;
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /** Definition for a class with a public {@code (String, Map<String, Object>)} constructor. */
  public static JobDefinition of(Class<? extends QueueJob> jobClass) {
    Constructor<? extends QueueJob> ctor;
    try {
      ctor = jobClass.getConstructor(String.class, Map.class);
    } catch (NoSuchMethodException e) {
      throw new IllegalArgumentException(
          jobClass.getName() + " needs a public (String, Map<String, Object>) constructor", e);
    }
    JobFactory reflective =
        (jobId, params) -> {
          try {
            return ctor.newInstance(jobId, params);
          } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
          }
        };
    return new JobDefinition(jobClass.getName(), jobClass, reflective);
  }

  public static JobDefinition of(String jobType, JobFactory factory) {
    return new JobDefinition(jobType, null, factory);
  }

  /** Resolve a class-based definition by name, e.g. for records recovered after a restart. */
  public static JobDefinition forClassName(String className, ClassLoader loader)
      throws ClassNotFoundException {
    Class<?> type = Class.forName(className, false, loader);
    if (!QueueJob.class.isAssignableFrom(type)) {
      throw new IllegalArgumentException(className + " does not implement QueueJob");
    }
    return of(type.asSubclass(QueueJob.class));
  }

  public String jobType() {
    return jobType;
  }

  /** The job class, or {@code null} for factory-based definitions. */
  public Class<? extends QueueJob> jobClass() {
    return jobClass;
  }

  public QueueJob instantiate(String jobId, Map<String, Object> params) throws Exception {
    QueueJob job = factory.create(jobId, params);
    if (job == null) {
      throw new IllegalStateException("Factory for " + jobType + " returned null");
    }
    return job;
  }

  @Override
  public String toString() {
    return "JobDefinition[" + jobType + "]";
  }
}
