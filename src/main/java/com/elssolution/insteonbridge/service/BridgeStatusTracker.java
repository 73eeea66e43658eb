package com.elssolution.insteonbridge.service;

import com.elssolution.insteonbridge.config.BridgeSettings;
import com.elssolution.insteonbridge.domain.BridgeStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * Process-wide bridge status. Connection fields are written by the supervisor, the
 * device count and discovery time by the registry (inside its cache lock).
 */
@Component
public class BridgeStatusTracker {

    private final String port;

    private boolean connected;
    private String state = "IDLE";
    private int connectAttempts;
    private int successfulConnects;
    private String lastError;
    private int deviceCount;
    private Instant lastDiscovery;
    private boolean mockMode;

    public BridgeStatusTracker(BridgeSettings settings) {
        this.port = settings.getSerialPort();
    }

    public synchronized void recordAttempt() {
        connectAttempts++;
    }

    public synchronized void recordConnected(boolean mock) {
        connected = true;
        mockMode = mock;
        successfulConnects++;
        if (!mock) lastError = null; // keep the reason we fell back
    }

    public synchronized void recordDisconnected() {
        connected = false;
        mockMode = false;
    }

    public synchronized void recordError(String error) {
        lastError = error;
    }

    public synchronized void recordState(String newState) {
        state = newState;
    }

    public synchronized void updateDeviceCount(int count) {
        deviceCount = count;
    }

    public synchronized void recordDiscovery(int count, Instant at) {
        deviceCount = count;
        lastDiscovery = at;
    }

    public synchronized boolean isConnected() {
        return connected;
    }

    public synchronized String lastError() {
        return lastError;
    }

    public synchronized boolean isMockMode() {
        return mockMode;
    }

    public synchronized int connectAttempts() {
        return connectAttempts;
    }

    public synchronized BridgeStatus snapshot(int subscribers) {
        return BridgeStatus.builder()
                .connected(connected)
                .port(port)
                .state(state)
                .connectAttempts(connectAttempts)
                .successfulConnects(successfulConnects)
                .lastError(lastError)
                .deviceCount(deviceCount)
                .lastDiscovery(lastDiscovery == null ? null
                        : OffsetDateTime.ofInstant(lastDiscovery, ZoneId.systemDefault()).toString())
                .mockMode(mockMode)
                .subscribers(subscribers)
                .build();
    }
}
