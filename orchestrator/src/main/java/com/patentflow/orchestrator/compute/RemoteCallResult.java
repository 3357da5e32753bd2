package com.patentflow.orchestrator.compute;

/**
 * A successful remote call together with the number of attempts it took.
 */
public record RemoteCallResult(RemoteEnvelope envelope, int attempts) {}
