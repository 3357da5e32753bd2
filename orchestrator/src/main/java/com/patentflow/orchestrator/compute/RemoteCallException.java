package com.patentflow.orchestrator.compute;

/**
 * Thrown when the remote compute endpoint returns an error or is unreachable.
 *
 * The base type is terminal. Only {@link TransientRemoteException} is retried.
 */
public class RemoteCallException extends RuntimeException {

    // HTTP status when the endpoint answered, otherwise null.
    private final Integer statusCode;

    public RemoteCallException(String message) {
        this(message, null, null);
    }

    public RemoteCallException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public RemoteCallException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer statusCode() { return statusCode; }
}
