package com.patentflow.orchestrator.compute;

/**
 * 4xx from the remote endpoint. The request itself is wrong; never retried.
 */
public class PermanentRemoteException extends RemoteCallException {

    public PermanentRemoteException(String message, int statusCode) {
        super(message, statusCode, null);
    }
}
