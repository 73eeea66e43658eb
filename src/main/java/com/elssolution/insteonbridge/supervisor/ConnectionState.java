package com.elssolution.insteonbridge.supervisor;

public enum ConnectionState {
    IDLE,
    CONNECTING,
    CONNECTED,
    MOCK_CONNECTED,
    DISCONNECTED,
    STOPPED
}
