package com.patentflow.orchestrator.compute;

import java.time.Duration;

/**
 * Blocking wait used between retries. Replaced in tests so backoff runs instantly.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
