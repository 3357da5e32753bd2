package com.patentflow.orchestrator.compute;

import com.patentflow.orchestrator.stage.StageDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Calls a stage's remote endpoint with bounded retries.
 *
 * Classification:
 *   2xx                          → return the envelope
 *   4xx, malformed envelope      → fail immediately
 *   5xx, timeout, reset, I/O     → wait 2^attempt seconds and try again,
 *                                  up to maxAttempts; then rethrow the last error
 *
 * Every call is counted:
 * <pre>
 *   patentflow.remote.calls{stage, outcome="success|rejected|protocol|exhausted|error"}
 *   patentflow.remote.attempts{stage}   (distribution of attempts per call)
 * </pre>
 */
@Component
public class RetryingComputeCaller {

    private static final Logger log = LoggerFactory.getLogger(RetryingComputeCaller.class);

    private final ComputeClient client;
    private final MeterRegistry meterRegistry;
    private final RetryPolicy   policy;
    private final Sleeper       sleeper;

    @Autowired
    public RetryingComputeCaller(ComputeClient client,
                                 MeterRegistry meterRegistry,
                                 @Value("${patentflow.retry.max-attempts:5}") int maxAttempts,
                                 @Value("${patentflow.retry.base-delay:1s}") Duration baseDelay) {
        this(client, meterRegistry, new RetryPolicy(maxAttempts, baseDelay), Sleeper.THREAD);
    }

    public RetryingComputeCaller(ComputeClient client, MeterRegistry meterRegistry,
                                 RetryPolicy policy, Sleeper sleeper) {
        this.client        = client;
        this.meterRegistry = meterRegistry;
        this.policy        = policy;
        this.sleeper       = sleeper;
    }

    public RemoteCallResult call(StageDefinition stage, Map<String, Object> payload) {
        TransientRemoteException last = null;
        for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
            int attemptNo = attempt + 1;
            try {
                log.info("Remote call '{}' attempt {}/{}", stage.endpointName(), attemptNo, policy.maxAttempts());
                RemoteEnvelope envelope = client.invoke(stage.endpointName(), payload);
                record(stage, "success", attemptNo);
                return new RemoteCallResult(envelope, attemptNo);
            } catch (TransientRemoteException e) {
                last = e;
                log.warn("Remote call '{}' attempt {}/{} failed: {}",
                        stage.endpointName(), attemptNo, policy.maxAttempts(), e.getMessage());
            } catch (PermanentRemoteException e) {
                record(stage, "rejected", attemptNo);
                throw e;
            } catch (ProtocolException e) {
                record(stage, "protocol", attemptNo);
                throw e;
            } catch (RemoteCallException e) {
                record(stage, "error", attemptNo);
                throw e;
            }

            if (attemptNo < policy.maxAttempts()) {
                Duration wait = policy.backoff(attempt);
                log.info("Retrying '{}' in {} ms", stage.endpointName(), wait.toMillis());
                pause(wait, stage, attemptNo);
            }
        }
        record(stage, "exhausted", policy.maxAttempts());
        log.error("Remote call '{}' gave up after {} attempts", stage.endpointName(), policy.maxAttempts());
        throw last;
    }

    public RetryPolicy policy() {
        return policy;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void pause(Duration wait, StageDefinition stage, int attemptNo) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            record(stage, "error", attemptNo);
            throw new RemoteCallException("Retry of '" + stage.endpointName() + "' interrupted", e);
        }
    }

    private void record(StageDefinition stage, String outcome, int attempts) {
        meterRegistry.counter("patentflow.remote.calls", "stage", stage.key(), "outcome", outcome).increment();
        meterRegistry.summary("patentflow.remote.attempts", "stage", stage.key()).record(attempts);
    }
}
