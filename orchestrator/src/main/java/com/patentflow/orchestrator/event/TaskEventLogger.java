package com.patentflow.orchestrator.event;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs every task event and counts it per topic.
 *
 * Metrics: patentflow.task.events{topic}
 */
@Component
public class TaskEventLogger {

    private static final Logger log = LoggerFactory.getLogger(TaskEventLogger.class);

    private final MeterRegistry meterRegistry;

    public TaskEventLogger(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @EventListener
    public void on(TaskEvent event) {
        meterRegistry.counter("patentflow.task.events", "topic", event.topic()).increment();
        if (event.isFailure()) {
            log.warn("Event {} record={} error={}", event.topic(), event.recordId(), event.error());
        } else {
            log.info("Event {} record={}", event.topic(), event.recordId());
        }
    }
}
