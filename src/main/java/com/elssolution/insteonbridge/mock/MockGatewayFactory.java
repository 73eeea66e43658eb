package com.elssolution.insteonbridge.mock;

import com.elssolution.insteonbridge.config.BridgeSettings;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledExecutorService;

/** Builds and starts a fresh mock gateway each time mock mode is entered. */
@Component
public class MockGatewayFactory {

    private final BridgeSettings settings;
    private final ScheduledExecutorService scheduler;

    public MockGatewayFactory(BridgeSettings settings, ScheduledExecutorService scheduler) {
        this.settings = settings;
        this.scheduler = scheduler;
    }

    public MockGateway start() {
        MockGateway gateway = new MockGateway();
        gateway.start(scheduler, settings.mockCycle());
        return gateway;
    }
}
