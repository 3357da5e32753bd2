package com.patentflow.orchestrator.compute;

/**
 * 5xx, timeouts, connection resets and other network-level faults. Retried with backoff.
 */
public class TransientRemoteException extends RemoteCallException {

    public TransientRemoteException(String message, Integer statusCode) {
        super(message, statusCode, null);
    }

    public TransientRemoteException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
