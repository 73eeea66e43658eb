package com.elssolution.insteonbridge.health;

import com.elssolution.insteonbridge.domain.BridgeStatus;
import com.elssolution.insteonbridge.service.InsteonBridgeService;
import org.springframework.boot.actuate.health.*;
import org.springframework.stereotype.Component;

@Component
public class BridgeHealth implements HealthIndicator {
    private final InsteonBridgeService bridge;

    public BridgeHealth(InsteonBridgeService bridge) { this.bridge = bridge; }

    @Override public Health health() {
        BridgeStatus s = bridge.statusSnapshot();
        return (s.isConnected() ? Health.up() : Health.down())
                .withDetail("port", s.getPort())
                .withDetail("mode", s.isMockMode() ? "mock" : "live")
                .withDetail("state", s.getState())
                .withDetail("connectAttempts", s.getConnectAttempts())
                .withDetail("deviceCount", s.getDeviceCount())
                .withDetail("lastError", s.getLastError() == null ? "-" : s.getLastError())
                .build();
    }
}
