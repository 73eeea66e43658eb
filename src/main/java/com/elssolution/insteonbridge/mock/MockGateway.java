package com.elssolution.insteonbridge.mock;

import com.elssolution.insteonbridge.domain.Capability;
import com.elssolution.insteonbridge.domain.DeviceIds;
import com.elssolution.insteonbridge.gateway.Gateway;
import com.elssolution.insteonbridge.gateway.GatewayDevice;
import com.elssolution.insteonbridge.gateway.GatewayListener;
import com.elssolution.insteonbridge.gateway.GatewayModem;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;

/**
 * In-process stand-in for a PLM: three synthetic devices that can be driven like real
 * ones and, once started, flip themselves on and off so the event feed has traffic.
 */
@Slf4j
public class MockGateway implements Gateway {

    public static final String MODEM_ADDRESS = "99.99.99";

    private final List<MockDevice> devices = new CopyOnWriteArrayList<>();
    private final List<GatewayListener> listeners = new CopyOnWriteArrayList<>();
    private final GatewayModem modem = new GatewayModem() {
        @Override public String address() { return MODEM_ADDRESS; }

        @Override public CompletableFuture<Void> close() { return CompletableFuture.completedFuture(null); }
    };

    private volatile ScheduledExecutorService scheduler;
    private volatile Duration cycle = Duration.ZERO;
    private volatile boolean closed;

    public MockGateway() {
        devices.add(new MockDevice("11.11.11", "Mock Dimmer", 0x01, 0x20, "2477D",
                EnumSet.of(Capability.DIMMER, Capability.FAST_ON, Capability.FAST_OFF, Capability.STATUS_QUERY)));
        devices.add(new MockDevice("22.22.22", "Mock Switch", 0x02, 0x2a, "2477S",
                EnumSet.of(Capability.SWITCH, Capability.FAST_ON, Capability.FAST_OFF, Capability.STATUS_QUERY)));
        devices.add(new MockDevice("33.33.33", "Mock Keypad", 0x01, 0x41, "2334-232",
                EnumSet.of(Capability.DIMMER, Capability.KEYPAD, Capability.SCENE_CONTROLLER, Capability.STATUS_QUERY)));
    }

    /** Starts the per-device on/off cycle. A non-positive interval disables it. */
    public void start(ScheduledExecutorService scheduler, Duration cycleInterval) {
        this.scheduler = scheduler;
        this.cycle = cycleInterval;
        if (scheduler == null) return;
        devices.forEach(d -> d.startCycle(scheduler, cycleInterval));
        log.info("mock_gateway_started devices={} cycle={}s", devices.size(), cycleInterval.toMillis() / 1000.0);
    }

    @Override
    public Collection<GatewayDevice> devices() {
        return new ArrayList<>(devices);
    }

    public List<MockDevice> mockDevices() {
        return List.copyOf(devices);
    }

    @Override
    public CompletableFuture<Void> load(boolean refresh) {
        log.debug("mock_gateway_load refresh={}", refresh);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public Optional<GatewayModem> modem() {
        return Optional.of(modem);
    }

    @Override
    public void subscribe(GatewayListener listener) {
        listeners.add(listener);
    }

    @Override
    public void unsubscribe(GatewayListener listener) {
        listeners.remove(listener);
    }

    /** Adds a device at runtime and announces it like a real gateway would. */
    public void addDevice(MockDevice device) {
        devices.add(device);
        if (scheduler != null && !closed) device.startCycle(scheduler, cycle);
        listeners.forEach(l -> l.onDeviceChange(GatewayListener.DeviceChange.ADDED, device.address()));
    }

    public void removeDevice(String address) {
        String id = DeviceIds.normalize(address);
        devices.stream()
                .filter(d -> DeviceIds.normalize(d.address()).equals(id))
                .findFirst()
                .ifPresent(d -> {
                    d.stopCycle();
                    devices.remove(d);
                    listeners.forEach(l -> l.onDeviceChange(GatewayListener.DeviceChange.REMOVED, d.address()));
                });
    }

    /** Simulates the serial link dropping. */
    public void dropConnection(Throwable cause) {
        listeners.forEach(l -> l.onConnectionLost(cause));
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public CompletableFuture<Void> close() {
        closed = true;
        devices.forEach(MockDevice::stopCycle);
        listeners.clear();
        log.info("mock_gateway_closed");
        return CompletableFuture.completedFuture(null);
    }
}
