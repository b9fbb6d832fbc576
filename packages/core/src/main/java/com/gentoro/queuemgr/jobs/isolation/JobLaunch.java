package com.gentoro.queuemgr.jobs.isolation;

import com.gentoro.queuemgr.jobs.JobContext;
import com.gentoro.queuemgr.jobs.JobDefinition;
import com.gentoro.queuemgr.jobs.ResultGuard;
import java.util.Map;

/** Everything an isolation mode needs to run one job. */
public record JobLaunch(
    JobDefinition definition,
    String jobId,
    Map<String, Object> params,
    ResultGuard guard,
    JobContext.ProgressReporter progress) {}
