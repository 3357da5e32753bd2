package com.patentflow.orchestrator.compute;

/**
 * The remote endpoint's response wrapper.
 *
 * @param res         compressed result blob (gzip + base64 JSON)
 * @param timeSeconds elapsed time reported by the remote side ("TIME(s)")
 * @param cost        cost reported by the remote side
 */
public record RemoteEnvelope(String res, double timeSeconds, double cost) {}
