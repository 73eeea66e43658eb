package com.elssolution.insteonbridge.mock;

import com.elssolution.insteonbridge.domain.Capability;
import com.elssolution.insteonbridge.gateway.DeviceEventListener;
import com.elssolution.insteonbridge.gateway.DeviceOperation;
import com.elssolution.insteonbridge.gateway.GatewayDevice;
import com.elssolution.insteonbridge.gateway.StateChangeListener;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Synthetic device with a single "level" channel (0..255). Every operation updates the
 * channel and fires the subscribed callbacks synchronously on the calling thread.
 */
@Slf4j
public class MockDevice implements GatewayDevice {

    static final int GROUP = 1;
    static final int FULL = 255;

    private final String address;
    private final String name;
    private final int category;
    private final int subcategory;
    private final String model;
    private final Set<Capability> capabilities;

    private final MockNotificationSource<StateChangeListener> levelGroup = new MockNotificationSource<>("level", GROUP);
    private final Map<String, MockNotificationSource<DeviceEventListener>> eventSources = new LinkedHashMap<>();
    private final Map<String, DeviceOperation> operations = new LinkedHashMap<>();

    private volatile int level;
    private volatile Instant lastSeen;
    private volatile ScheduledFuture<?> cycle;

    public MockDevice(String address, String name, int category, int subcategory, String model,
                      Set<Capability> capabilities) {
        this.address = address;
        this.name = name;
        this.category = category;
        this.subcategory = subcategory;
        this.model = model;
        this.capabilities = capabilities.isEmpty() ? Set.of() : EnumSet.copyOf(capabilities);

        for (String ev : List.of("on", "off", "on_fast", "off_fast")) {
            eventSources.put(ev, new MockNotificationSource<>(ev, GROUP));
        }
        operations.put("turn_on", args -> apply(args.level().orElse(FULL), "on"));
        operations.put("turn_off", args -> apply(0, "off"));
        operations.put("fast_on", args -> apply(FULL, "on_fast"));
        operations.put("fast_off", args -> apply(0, "off_fast"));
        operations.put("status_request", args -> {
            touch();
            publishLevel();
            return CompletableFuture.completedFuture(null);
        });
    }

    // ---- GatewayDevice ----

    @Override public String address() { return address; }

    @Override public Optional<String> name() { return Optional.of(name); }

    @Override public Optional<Integer> category() { return Optional.of(category); }

    @Override public Optional<Integer> subcategory() { return Optional.of(subcategory); }

    @Override public Optional<String> model() { return Optional.of(model); }

    @Override public Optional<String> firmware() { return Optional.of("mock"); }

    @Override public Optional<String> productKey() { return Optional.of("MOCK"); }

    @Override public Set<Capability> declaredCapabilities() { return capabilities; }

    @Override
    public Map<String, Object> states() {
        Map<String, Object> s = new LinkedHashMap<>();
        s.put("level", level);
        return s;
    }

    @Override public Optional<Instant> lastSeen() { return Optional.ofNullable(lastSeen); }

    @Override
    public List<MockNotificationSource<DeviceEventListener>> eventSources() {
        return List.copyOf(eventSources.values());
    }

    @Override
    public List<MockNotificationSource<StateChangeListener>> stateGroups() {
        return List.of(levelGroup);
    }

    @Override
    public Optional<DeviceOperation> operation(String opName) {
        return Optional.ofNullable(operations.get(opName));
    }

    // ---- mock behaviour ----

    public int level() {
        return level;
    }

    public boolean isOn() {
        return level > 0;
    }

    /** Alternate on/off every {@code interval} until {@link #stopCycle()}. */
    void startCycle(ScheduledExecutorService scheduler, Duration interval) {
        if (interval.isZero() || interval.isNegative() || cycle != null) return;
        long ms = interval.toMillis();
        cycle = scheduler.scheduleWithFixedDelay(this::toggleSafe, ms, ms, TimeUnit.MILLISECONDS);
    }

    void stopCycle() {
        ScheduledFuture<?> c = cycle;
        if (c != null) c.cancel(false);
        cycle = null;
    }

    int subscriberCount() {
        int n = levelGroup.listenerCount();
        for (MockNotificationSource<DeviceEventListener> s : eventSources.values()) n += s.listenerCount();
        return n;
    }

    private void toggleSafe() {
        try {
            if (isOn()) apply(0, "off");
            else apply(FULL, "on");
        } catch (RuntimeException e) {
            log.warn("mock_cycle_failed device={}: {}", address, e.toString());
        }
    }

    private CompletableFuture<Void> apply(int newLevel, String event) {
        level = Math.max(0, Math.min(FULL, newLevel));
        touch();
        if (log.isDebugEnabled()) log.debug("mock_device_{} address={} level={}", event, address, level);
        MockNotificationSource<DeviceEventListener> source = eventSources.get(event);
        if (source != null) source.fire(l -> l.onEvent(event, address, GROUP, ""));
        publishLevel();
        return CompletableFuture.completedFuture(null);
    }

    private void publishLevel() {
        int v = level;
        levelGroup.fire(l -> l.onStateChange("level", address, v, GROUP));
    }

    private void touch() {
        lastSeen = Instant.now();
    }
}
