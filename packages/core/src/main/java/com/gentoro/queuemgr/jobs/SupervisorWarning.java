package com.gentoro.queuemgr.jobs;

import java.time.Instant;

/**
 * A non-fatal problem observed while running a job, such as a lifecycle hook that threw.
 *
 * @param jobId job the warning belongs to
 * @param source where it happened: {@code onStart}, {@code onEnd}, {@code onError}, {@code guard}
 *     or {@code supervisor}
 * @param message description of the problem
 * @param timestamp when it was observed
 */
public record SupervisorWarning(String jobId, String source, String message, Instant timestamp) {}
