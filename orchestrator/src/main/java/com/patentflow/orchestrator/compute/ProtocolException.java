package com.patentflow.orchestrator.compute;

/**
 * The endpoint answered 2xx but the envelope is malformed or incomplete.
 * Not retried: asking again is unlikely to produce a well-formed answer.
 */
public class ProtocolException extends RemoteCallException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
