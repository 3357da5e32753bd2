package com.patentflow.orchestrator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes task events as Spring application events.
 *
 * Listeners run synchronously on the publishing thread; an exception thrown by
 * one is logged here and goes no further.
 */
@Component
public class SpringTaskEventBus implements TaskEventBus {

    private static final Logger log = LoggerFactory.getLogger(SpringTaskEventBus.class);

    private final ApplicationEventPublisher publisher;

    public SpringTaskEventBus(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void publish(TaskEvent event) {
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("Could not publish event {} for record {}: {}",
                    event.topic(), event.recordId(), e.getMessage(), e);
        }
    }
}
