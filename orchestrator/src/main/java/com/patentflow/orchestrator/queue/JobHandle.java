package com.patentflow.orchestrator.queue;

import java.time.Duration;
import java.time.Instant;

/**
 * Receipt for a job accepted by the {@link JobQueue}.
 */
public record JobHandle(String jobId, String jobName, Instant enqueuedAt, Duration timeout) {}
