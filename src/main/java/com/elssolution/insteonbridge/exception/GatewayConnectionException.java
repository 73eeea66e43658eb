package com.elssolution.insteonbridge.exception;

/**
 * Failure while connecting to or tearing down a gateway. Handled inside the supervisor
 * (retry, backoff, mock fallback) and never surfaced to callers.
 */
public class GatewayConnectionException extends Exception {

    public GatewayConnectionException(String message) {
        super(message);
    }

    public GatewayConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
