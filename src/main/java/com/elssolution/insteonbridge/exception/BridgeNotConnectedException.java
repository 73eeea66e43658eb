package com.elssolution.insteonbridge.exception;

/**
 * Raised when an operation needs an active gateway connection and none is available.
 */
public class BridgeNotConnectedException extends RuntimeException {

    public BridgeNotConnectedException(String message) {
        super(message);
    }

    public BridgeNotConnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
