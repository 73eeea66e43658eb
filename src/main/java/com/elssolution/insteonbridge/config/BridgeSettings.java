package com.elssolution.insteonbridge.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * All bridge knobs, read once at startup. Field initializers mirror the property
 * defaults so the class is usable without a Spring context.
 */
@Component
@Getter @Setter
public class BridgeSettings {

    // ==== Serial / gateway ====
    @Value("${insteon.serial.port:/dev/insteon}")  private String serialPort = "/dev/insteon";
    @Value("${insteon.serial.probe:true}")         private boolean serialProbe = true;

    // ==== Reconnect ====
    @Value("${insteon.reconnect.initialSeconds:5}") private double reconnectInitialSeconds = 5;
    @Value("${insteon.reconnect.maxSeconds:60}")    private double reconnectMaxSeconds = 60;
    @Value("${insteon.teardown.timeoutSeconds:5}")  private double teardownTimeoutSeconds = 5;

    // ==== Discovery / cache ====
    @Value("${insteon.discovery.refreshDefault:true}") private boolean discoveryRefreshDefault = true;
    @Value("${insteon.cache.path:/opt/homebrain/insteon/devices.json}")
    private String cachePath = "/opt/homebrain/insteon/devices.json";

    // ==== Mock mode ====
    @Value("${insteon.mock.allowed:false}")          private boolean mockAllowed = false;
    @Value("${insteon.mock.fallbackOnFailure:true}") private boolean mockFallbackOnFailure = true;
    @Value("${insteon.mock.forced:false}")           private boolean mockForced = false;
    @Value("${insteon.mock.cycleSeconds:15}")        private double mockCycleSeconds = 15;

    // ==== Events / misc ====
    @Value("${insteon.events.capacity:1000}")        private int eventCapacity = 1000;
    @Value("${insteon.status.summarySeconds:30}")    private int statusSummarySeconds = 30;
    @Value("${insteon.auth.token:}")                 private String authToken = "";
    @Value("${insteon.autoStart:true}")              private boolean autoStart = true;

    /** Forcing mock mode implies it is allowed. */
    public boolean isMockPermitted() {
        return mockAllowed || mockForced;
    }

    public boolean isMockFallbackPermitted() {
        return isMockPermitted() && mockFallbackOnFailure;
    }

    public Path cacheFile() {
        return Path.of(cachePath);
    }

    public Duration reconnectInitial() {
        return seconds(reconnectInitialSeconds);
    }

    public Duration reconnectMax() {
        return seconds(Math.max(reconnectMaxSeconds, reconnectInitialSeconds));
    }

    public Duration teardownTimeout() {
        return seconds(teardownTimeoutSeconds);
    }

    public Duration mockCycle() {
        return seconds(mockCycleSeconds);
    }

    private static Duration seconds(double s) {
        return Duration.ofMillis(Math.round(Math.max(0, s) * 1000));
    }
}
