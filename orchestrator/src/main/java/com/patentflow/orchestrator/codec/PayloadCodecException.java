package com.patentflow.orchestrator.codec;

/**
 * Thrown when a payload cannot be compressed, or a result blob cannot be restored.
 */
public class PayloadCodecException extends RuntimeException {

    public PayloadCodecException(String message) {
        super(message);
    }

    public PayloadCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
