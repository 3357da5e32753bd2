package com.patentflow.orchestrator.stage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All configured pipeline stages, keyed by stage key.
 *
 * Every {@link StageDefinition} bean is collected at startup via constructor
 * injection, so adding a stage only requires declaring one more bean.
 *
 * The registry also owns the job queue's wall-clock ceiling and enforces the
 * one timing invariant the design depends on: every stage's liveness timeout is
 * strictly shorter than the ceiling, so the reaper always fails a silent task
 * before the queue kills it. A misconfiguration stops the application at boot
 * instead of silently disabling the reaper.
 */
@Component
public class StageRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageRegistry.class);

    private final Map<String, StageDefinition> stages;
    private final Duration jobTimeout;

    public StageRegistry(List<StageDefinition> definitions,
                         @Value("${patentflow.queue.job-timeout:70m}") Duration jobTimeout) {
        this.jobTimeout = jobTimeout;
        Map<String, StageDefinition> byKey = new LinkedHashMap<>();
        for (StageDefinition stage : definitions) {
            if (byKey.putIfAbsent(stage.key(), stage) != null) {
                throw new IllegalStateException("Duplicate stage key: '" + stage.key() + "'");
            }
            if (stage.timeout().compareTo(jobTimeout) >= 0) {
                throw new IllegalStateException("Stage '" + stage.key() + "' timeout " + stage.timeout()
                        + " must be shorter than the job queue timeout " + jobTimeout);
            }
            log.info("Registered stage '{}' [endpoint={}, prefix={}, timeout={}, heartbeat={}]",
                    stage.key(), stage.endpointName(), stage.stepIdPrefix(),
                    stage.timeout(), stage.heartbeatInterval());
        }
        this.stages = Collections.unmodifiableMap(byKey);
    }

    public Optional<StageDefinition> find(String key) {
        return Optional.ofNullable(stages.get(key));
    }

    public StageDefinition get(String key) {
        StageDefinition stage = stages.get(key);
        if (stage == null) {
            throw new UnknownStageException(key);
        }
        return stage;
    }

    /** Stages in registration order. */
    public Collection<StageDefinition> all() {
        return stages.values();
    }

    /** Wall-clock ceiling handed to the job queue for every task. */
    public Duration jobTimeout() {
        return jobTimeout;
    }
}
