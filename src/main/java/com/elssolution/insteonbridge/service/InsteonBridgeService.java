package com.elssolution.insteonbridge.service;

import com.elssolution.insteonbridge.command.CommandDispatcher;
import com.elssolution.insteonbridge.config.BridgeSettings;
import com.elssolution.insteonbridge.domain.BridgeEvent;
import com.elssolution.insteonbridge.domain.BridgeStatus;
import com.elssolution.insteonbridge.domain.DeviceSnapshot;
import com.elssolution.insteonbridge.events.EventPipeline;
import com.elssolution.insteonbridge.events.EventSubscriber;
import com.elssolution.insteonbridge.registry.DeviceRegistry;
import com.elssolution.insteonbridge.registry.DiscoveryResult;
import com.elssolution.insteonbridge.supervisor.ConnectionSupervisor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * The operations the HTTP/WebSocket layer calls. Thin: everything with state lives in
 * the supervisor, the registry and the event pipeline.
 */
@Slf4j
@Service
public class InsteonBridgeService {

    private final BridgeSettings settings;
    private final ConnectionSupervisor supervisor;
    private final DeviceRegistry registry;
    private final CommandDispatcher commands;
    private final EventPipeline events;
    private final BridgeStatusTracker status;
    private final ScheduledExecutorService scheduler;

    private volatile ScheduledFuture<?> summaryHandle;

    public InsteonBridgeService(BridgeSettings settings,
                                ConnectionSupervisor supervisor,
                                DeviceRegistry registry,
                                CommandDispatcher commands,
                                EventPipeline events,
                                BridgeStatusTracker status,
                                ScheduledExecutorService scheduler) {
        this.settings = settings;
        this.supervisor = supervisor;
        this.registry = registry;
        this.commands = commands;
        this.events = events;
        this.status = status;
        this.scheduler = scheduler;
    }

    // ---- Lifecycle ----

    @PostConstruct
    void autoStart() {
        int every = settings.getStatusSummarySeconds();
        if (every > 0) {
            summaryHandle = scheduler.scheduleAtFixedRate(this::logSummarySafe, every, every, TimeUnit.SECONDS);
            log.info("Status summary logger started: every {}s", every);
        }
        if (settings.isAutoStart()) start();
    }

    @PreDestroy
    void shutdown() {
        ScheduledFuture<?> h = summaryHandle;
        if (h != null) h.cancel(false);
        stop();
    }

    public void start() {
        supervisor.start();
    }

    public void stop() {
        supervisor.stop();
    }

    public boolean waitUntilConnected(double timeoutSeconds) {
        return supervisor.waitUntilConnected(Duration.ofMillis(Math.round(Math.max(0, timeoutSeconds) * 1000)));
    }

    // ---- Devices ----

    public DiscoveryResult runDiscovery(Boolean refresh) {
        return registry.runDiscovery(refresh);
    }

    public List<DeviceSnapshot> listDevices() {
        return registry.listDevices();
    }

    public DeviceSnapshot getDevice(String deviceId) {
        return registry.getDevice(deviceId);
    }

    public BridgeEvent sendCommand(String deviceId, String command, Integer level, Boolean fast, Double duration) {
        return commands.sendCommand(deviceId, command, level, Boolean.TRUE.equals(fast), duration);
    }

    // ---- Status / subscribers ----

    public BridgeStatus statusSnapshot() {
        return status.snapshot(events.subscriberCount());
    }

    public void attachSubscriber(EventSubscriber subscriber) {
        events.attach(subscriber);
    }

    public void detachSubscriber(EventSubscriber subscriber) {
        events.detach(subscriber);
    }

    // ---- Log summary ----

    private void logSummarySafe() {
        try {
            BridgeStatus s = statusSnapshot();
            log.info("Status: connected={} mode={} state={} port={} attempts={} (ok {}), devices={}, " +
                            "lastDiscovery={}, subscribers={}, queued={}/{}, dropped={}, lastError={}",
                    s.isConnected(), s.isMockMode() ? "mock" : "live", s.getState(), s.getPort(),
                    s.getConnectAttempts(), s.getSuccessfulConnects(), s.getDeviceCount(),
                    s.getLastDiscovery() == null ? "-" : s.getLastDiscovery(), s.getSubscribers(),
                    events.pending(), events.capacity(), events.droppedCount(),
                    s.getLastError() == null ? "-" : s.getLastError());
        } catch (Exception e) {
            log.warn("status_summary_failed: {}", e.getMessage());
        }
    }
}
