package com.elssolution.insteonbridge.supervisor;

import com.elssolution.insteonbridge.alerts.GatewayCrashedEvent;
import com.elssolution.insteonbridge.config.BridgeSettings;
import com.elssolution.insteonbridge.config.SchedulingConfig;
import com.elssolution.insteonbridge.domain.BridgeEvent;
import com.elssolution.insteonbridge.domain.DeviceIds;
import com.elssolution.insteonbridge.domain.DeviceSnapshot;
import com.elssolution.insteonbridge.events.EventPipeline;
import com.elssolution.insteonbridge.gateway.Gateway;
import com.elssolution.insteonbridge.gateway.GatewayConnector;
import com.elssolution.insteonbridge.gateway.GatewayListener;
import com.elssolution.insteonbridge.gateway.GatewayModem;
import com.elssolution.insteonbridge.mock.MockGatewayFactory;
import com.elssolution.insteonbridge.registry.DeviceRegistry;
import com.elssolution.insteonbridge.registry.DiscoveryResult;
import com.elssolution.insteonbridge.service.BridgeStatusTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Owns the gateway connection.
 *
 * State machine:
 *   IDLE → CONNECTING → CONNECTED ──(loss)──→ DISCONNECTED → (backoff) → CONNECTING
 *                     ↘ MOCK_CONNECTED (forced, or fallback after a failed connect)
 *   any → STOPPED on {@link #stop()}
 *
 * Two worker threads: the connect loop ("insteon-connect-") and the event dispatch
 * loop ("insteon-events-"). Everything waits on {@code monitor}, so stop and
 * connection loss wake the connect loop immediately.
 */
@Slf4j
@Component
public class ConnectionSupervisor {

    // ==== Dependencies ====
    private final BridgeSettings settings;
    private final GatewayConnector connector;
    private final MockGatewayFactory mockFactory;
    private final DeviceRegistry registry;
    private final EventPipeline events;
    private final BridgeStatusTracker status;

    // ==== Loop state (guarded by monitor) ====
    private final Object monitor = new Object();
    private final ReconnectBackoff backoff;
    private final GatewayListener gatewayListener = new SupervisorListener();
    private boolean running;
    private boolean stopRequested;
    private boolean connected;
    private Throwable connectionLost;
    private Gateway gateway;
    private volatile ConnectionState state = ConnectionState.IDLE;

    private ExecutorService connectExecutor;
    private ExecutorService eventExecutor;
    private Future<?> connectTask;
    private Future<?> dispatchTask;

    public ConnectionSupervisor(BridgeSettings settings,
                                GatewayConnector connector,
                                MockGatewayFactory mockFactory,
                                DeviceRegistry registry,
                                EventPipeline events,
                                BridgeStatusTracker status) {
        this.settings = settings;
        this.connector = connector;
        this.mockFactory = mockFactory;
        this.registry = registry;
        this.events = events;
        this.status = status;
        this.backoff = new ReconnectBackoff(settings.reconnectInitial(), settings.reconnectMax());
    }

    // ---- Lifecycle ----

    /** Starts the connect and dispatch loops. No-op when already running. */
    public void start() {
        synchronized (monitor) {
            if (running) return;
            running = true;
            stopRequested = false;
            connectExecutor = Executors.newSingleThreadExecutor(SchedulingConfig.threads("insteon-connect-", null));
            eventExecutor = Executors.newSingleThreadExecutor(SchedulingConfig.threads("insteon-events-", null));
            connectTask = connectExecutor.submit(this::runConnectLoop);
            dispatchTask = eventExecutor.submit(events::runDispatchLoop);
        }
        log.info("supervisor_started port={} mockForced={} mockFallback={}",
                settings.getSerialPort(), settings.isMockForced(), settings.isMockFallbackPermitted());
    }

    /** Cancels both loops, waits for them, then tears the connection down. */
    public void stop() {
        ExecutorService ce;
        ExecutorService ee;
        synchronized (monitor) {
            if (!running) return;
            running = false;
            stopRequested = true;
            monitor.notifyAll();
            cancel(connectTask);
            cancel(dispatchTask);
            ce = connectExecutor;
            ee = eventExecutor;
            connectExecutor = null;
            eventExecutor = null;
        }
        awaitQuietly(ce, "connect");
        awaitQuietly(ee, "events");
        teardown();
        changeState(ConnectionState.STOPPED);
        log.info("supervisor_stopped");
    }

    /** True once connected (live or mock); false if {@code timeout} passes first. */
    public boolean waitUntilConnected(Duration timeout) {
        long deadline = System.nanoTime() + Math.max(0, timeout.toNanos());
        synchronized (monitor) {
            while (!connected) {
                long left = deadline - System.nanoTime();
                if (left <= 0) return false;
                try {
                    TimeUnit.NANOSECONDS.timedWait(monitor, left);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return connected;
                }
            }
            return true;
        }
    }

    public boolean isRunning() {
        synchronized (monitor) {
            return running;
        }
    }

    public boolean isConnected() {
        synchronized (monitor) {
            return connected;
        }
    }

    public ConnectionState state() {
        return state;
    }

    ReconnectBackoff backoff() {
        return backoff;
    }

    // ---- Connect loop ----

    void runConnectLoop() {
        log.debug("connect_loop_started");
        try {
            while (!isStopRequested()) {
                boolean backOff = true;
                try {
                    backOff = connectOnce();
                } catch (RuntimeException e) {
                    // submit() keeps this from any uncaught handler; record it and retry
                    status.recordError("Supervisor error: " + e);
                    log.error("connect_cycle_failed: {}", e.toString(), e);
                } finally {
                    teardown();
                }
                if (backOff) sleepBackoff();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        log.debug("connect_loop_stopped");
    }

    /** One connect-and-hold cycle. Returns true when the loop should back off before the next one. */
    private boolean connectOnce() throws InterruptedException {
        status.recordAttempt();
        changeState(ConnectionState.CONNECTING);

        if (settings.isMockForced()) {
            if (!activateMock("forced")) return true;
            awaitStopOrLoss();
            return false;
        }

        String port = settings.getSerialPort();
        log.info("gateway_connect_attempt port={} attempt={}", port, status.connectAttempts());
        Gateway gw;
        try {
            gw = connector.connect(port);
        } catch (Exception e) {
            String error = e.getMessage() != null ? e.getMessage() : e.toString();
            status.recordError(error);
            log.warn("gateway_connect_failed port={} attempt={}: {}", port, status.connectAttempts(), error);

            if (settings.isMockFallbackPermitted()) {
                if (!activateMock("fallback: " + error)) return true;
                awaitStopOrLoss();
                return false;
            }
            events.publish(BridgeEvent.bridgeStatus(false, port, null, error));
            changeState(ConnectionState.DISCONNECTED);
            return true;
        }

        if (!establish(() -> gw, false)) return true;
        backoff.reset();
        return awaitStopOrLoss();
    }

    private boolean activateMock(String reason) {
        log.warn("mock_gateway_activated reason={}", reason);
        if (!establish(mockFactory::start, true)) return false;
        backoff.reset();
        return true;
    }

    /**
     * Wires a freshly opened gateway in. A failure here counts as a failed connect:
     * the caller backs off and the loop's teardown closes whatever was opened.
     */
    private boolean establish(Supplier<Gateway> opener, boolean mock) {
        try {
            onConnected(opener.get(), mock);
            return true;
        } catch (RuntimeException e) {
            String error = "Gateway setup failed: " + (e.getMessage() != null ? e.getMessage() : e.toString());
            status.recordError(error);
            log.warn("gateway_setup_failed port={} mock={}: {}", settings.getSerialPort(), mock, error, e);
            events.publish(BridgeEvent.bridgeStatus(false, settings.getSerialPort(), null, error));
            changeState(ConnectionState.DISCONNECTED);
            return false;
        }
    }

    private void onConnected(Gateway gw, boolean mock) {
        synchronized (monitor) {
            gateway = gw;
            connectionLost = null;
        }
        try {
            gw.subscribe(gatewayListener);
        } catch (RuntimeException e) {
            log.warn("gateway_subscribe_failed: {}", e.toString());
        }
        registry.attach(gw, mock);
        status.recordConnected(mock);
        changeState(mock ? ConnectionState.MOCK_CONNECTED : ConnectionState.CONNECTED);

        String mode = mock ? DiscoveryResult.MOCK : DiscoveryResult.LIVE;
        events.publish(BridgeEvent.bridgeStatus(true, settings.getSerialPort(), mode, null));
        registry.prime();

        synchronized (monitor) {
            connected = true;
            monitor.notifyAll();
        }
        log.info("gateway_connected port={} mode={} successfulConnects={}",
                settings.getSerialPort(), mode, status.snapshot(0).getSuccessfulConnects());
    }

    /**
     * Blocks until stop or connection loss.
     *
     * @return true when the connection was lost, false on stop
     */
    private boolean awaitStopOrLoss() throws InterruptedException {
        Throwable lost;
        synchronized (monitor) {
            while (!stopRequested && connectionLost == null) {
                monitor.wait();
            }
            if (stopRequested) return false;
            lost = connectionLost;
            connectionLost = null;
        }
        String error = "Connection lost: " + (lost.getMessage() != null ? lost.getMessage() : lost.toString());
        status.recordError(error);
        changeState(ConnectionState.DISCONNECTED);
        log.warn("gateway_connection_lost port={}: {}", settings.getSerialPort(), lost.toString());
        return true;
    }

    private void sleepBackoff() throws InterruptedException {
        Duration delay = backoff.nextDelay();
        log.info("reconnect_backoff delay={}s nextDelay={}s", delay.toMillis() / 1000.0, backoff.peek().toMillis() / 1000.0);
        long deadline = System.nanoTime() + delay.toNanos();
        synchronized (monitor) {
            while (!stopRequested) {
                long left = deadline - System.nanoTime();
                if (left <= 0) return;
                TimeUnit.NANOSECONDS.timedWait(monitor, left);
            }
        }
    }

    /** Flags the current connection as dead; the connect loop tears down and reconnects. */
    void markConnectionLost(Throwable cause) {
        synchronized (monitor) {
            if (stopRequested || gateway == null) return;
            connectionLost = cause != null ? cause : new IllegalStateException("connection lost");
            monitor.notifyAll();
        }
    }

    @EventListener
    public void onGatewayCrash(GatewayCrashedEvent evt) {
        log.warn("gateway_crash_event → forcing reconnect (cause: {})", String.valueOf(evt.cause()));
        markConnectionLost(evt.cause());
    }

    // ---- Teardown ----

    private void teardown() {
        Gateway gw;
        boolean wasConnected;
        synchronized (monitor) {
            gw = gateway;
            wasConnected = connected;
            gateway = null;
            connected = false;
        }
        if (gw == null) return;

        try {
            gw.unsubscribe(gatewayListener);
        } catch (RuntimeException e) {
            log.debug("gateway_unsubscribe_failed: {}", e.toString());
        }
        registry.detach();

        Optional<GatewayModem> modem;
        try {
            modem = gw.modem();
        } catch (RuntimeException e) {
            modem = Optional.empty();
        }
        closeQuietly("gateway", gw::close);
        modem.ifPresent(m -> closeQuietly("modem", m::close));

        status.recordDisconnected();
        if (wasConnected) {
            events.publish(BridgeEvent.bridgeStatus(false, settings.getSerialPort(), null, status.lastError()));
        }
        log.info("gateway_closed port={}", settings.getSerialPort());
    }

    private void closeQuietly(String what, Supplier<CompletableFuture<Void>> close) {
        Duration timeout = settings.teardownTimeout();
        try {
            CompletableFuture<Void> f = close.get();
            if (f != null) f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("{}_close_timeout after {}s", what, timeout.toMillis() / 1000.0);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("{}_close_interrupted", what);
        } catch (ExecutionException e) {
            log.warn("{}_close_failed: {}", what, String.valueOf(e.getCause()));
        } catch (RuntimeException e) {
            log.warn("{}_close_failed: {}", what, e.toString());
        }
    }

    // ---- internals ----

    void handleDeviceChange(GatewayListener.DeviceChange change, String address) {
        String id = DeviceIds.normalize(address);
        Gateway gw;
        synchronized (monitor) {
            gw = gateway;
        }
        if (gw == null) return;
        switch (change) {
            case ADDED -> gw.findDevice(id).ifPresentOrElse(device -> {
                DeviceSnapshot snapshot = registry.registerDevice(device, true);
                events.publish(BridgeEvent.deviceAdded(snapshot));
                log.info("device_added id={}", id);
            }, () -> log.debug("device_added_unknown id={}", id));
            case REMOVED -> {
                registry.unregisterDevice(id, true);
                events.publish(BridgeEvent.deviceRemoved(id));
                log.info("device_removed id={}", id);
            }
        }
    }

    private boolean isStopRequested() {
        synchronized (monitor) {
            return stopRequested;
        }
    }

    private void changeState(ConnectionState next) {
        ConnectionState prev = state;
        state = next;
        status.recordState(next.name());
        if (prev != next && log.isDebugEnabled()) log.debug("supervisor_state {} → {}", prev, next);
    }

    private static void cancel(Future<?> f) {
        if (f != null) f.cancel(true);
    }

    private void awaitQuietly(ExecutorService ex, String what) {
        if (ex == null) return;
        ex.shutdownNow();
        try {
            if (!ex.awaitTermination(settings.teardownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{}_loop_did_not_stop within {}s", what, settings.teardownTimeout().toMillis() / 1000.0);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    /** Gateway callbacks arrive on library threads: hand off before touching anything. */
    private final class SupervisorListener implements GatewayListener {
        @Override
        public void onDeviceChange(DeviceChange change, String address) {
            registry.handOff(() -> handleDeviceChange(change, address));
        }

        @Override
        public void onConnectionLost(Throwable cause) {
            markConnectionLost(cause);
        }
    }
}
