package com.gentoro.queuemgr.jobs;

import java.util.Map;

/** Creates the job instance for one execution. */
@FunctionalInterface
public interface JobFactory {
  QueueJob create(String jobId, Map<String, Object> params) throws Exception;
}
