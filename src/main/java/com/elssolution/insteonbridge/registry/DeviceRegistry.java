package com.elssolution.insteonbridge.registry;

import com.elssolution.insteonbridge.config.BridgeSettings;
import com.elssolution.insteonbridge.domain.BridgeEvent;
import com.elssolution.insteonbridge.domain.DeviceIds;
import com.elssolution.insteonbridge.domain.DeviceSnapshot;
import com.elssolution.insteonbridge.domain.DeviceSnapshots;
import com.elssolution.insteonbridge.events.EventPipeline;
import com.elssolution.insteonbridge.exception.BridgeNotConnectedException;
import com.elssolution.insteonbridge.exception.CachePersistenceException;
import com.elssolution.insteonbridge.exception.DeviceNotFoundException;
import com.elssolution.insteonbridge.exception.DiscoveryFailedException;
import com.elssolution.insteonbridge.gateway.DeviceEventListener;
import com.elssolution.insteonbridge.gateway.Gateway;
import com.elssolution.insteonbridge.gateway.GatewayDevice;
import com.elssolution.insteonbridge.gateway.NotificationSource;
import com.elssolution.insteonbridge.gateway.StateChangeListener;
import com.elssolution.insteonbridge.service.BridgeStatusTracker;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Authoritative device registry: normalized id → live handle, → active callbacks,
 * → last snapshot. The snapshot map is also the persisted cache.
 *
 * Locks:
 *   - discoveryLock (fair): one discovery in flight, later callers queue in order
 *   - cacheLock: read/modify/write of the snapshot map and the device-count/discovery status
 *   - registrationLock: swapping a device's callback list, so each id holds at most one set
 *
 * Device callbacks run on library threads; they only build a payload and hand it to
 * the notification executor, which does the actual registry work.
 */
@Slf4j
@Component
public class DeviceRegistry {

    // ==== Dependencies ====
    private final BridgeSettings settings;
    private final DeviceCacheStore store;
    private final EventPipeline events;
    private final BridgeStatusTracker status;
    private final Executor notificationExecutor;

    // ==== Per-connection state ====
    private final Map<String, GatewayDevice> liveDevices = new ConcurrentHashMap<>();
    private final Map<String, List<DeviceSubscription<?>>> subscriptions = new ConcurrentHashMap<>();
    private volatile Gateway gateway;
    private volatile boolean mockMode;

    // ==== Cache ====
    private final Map<String, DeviceSnapshot> cache = new ConcurrentHashMap<>();
    private final ReentrantLock cacheLock = new ReentrantLock();
    private final ReentrantLock discoveryLock = new ReentrantLock(true);
    private final ReentrantLock registrationLock = new ReentrantLock();

    public DeviceRegistry(BridgeSettings settings,
                          DeviceCacheStore store,
                          EventPipeline events,
                          BridgeStatusTracker status,
                          @Qualifier("notificationExecutor") Executor notificationExecutor) {
        this.settings = settings;
        this.store = store;
        this.events = events;
        this.status = status;
        this.notificationExecutor = notificationExecutor;
    }

    // ---- Lifecycle ----

    @PostConstruct
    public void loadCache() {
        try {
            Map<String, DeviceSnapshot> loaded = store.load();
            cacheLock.lock();
            try {
                cache.clear();
                cache.putAll(loaded);
                status.updateDeviceCount(cache.size());
            } finally {
                cacheLock.unlock();
            }
            log.info("cache_loaded devices={} path={}", loaded.size(), store.path());
        } catch (CachePersistenceException e) {
            log.warn("cache_load_failed path={}: {}", store.path(), rootMessage(e));
        }
    }

    /** Called by the supervisor once a gateway (real or mock) is connected. */
    public void attach(Gateway connected, boolean mock) {
        this.gateway = connected;
        this.mockMode = mock;
    }

    /** Drops every callback and live handle. The cache stays. */
    public void detach() {
        clearSubscriptions();
        liveDevices.clear();
        gateway = null;
        mockMode = false;
    }

    public Optional<Gateway> currentGateway() {
        return Optional.ofNullable(gateway);
    }

    public boolean isMockMode() {
        return mockMode;
    }

    // ---- Registration ----

    /**
     * Registers every device the gateway knows (minus the modem) and announces them
     * with a device_snapshot event. Holds the discovery lock so it never interleaves
     * with a discovery run.
     */
    public List<DeviceSnapshot> prime() {
        Gateway gw = gateway;
        if (gw == null) return List.of();
        discoveryLock.lock();
        try {
            List<DeviceSnapshot> snapshots = registerAll(gw);
            if (!snapshots.isEmpty()) {
                markDiscovery();
                persist();
                events.publish(BridgeEvent.deviceSnapshot(snapshots));
            }
            log.info("registry_primed devices={} mode={}", snapshots.size(), modeName());
            return snapshots;
        } finally {
            discoveryLock.unlock();
        }
    }

    /**
     * Snapshot the device, replace any earlier handle and callbacks under its id, then
     * subscribe to each event source and state group it offers.
     */
    public DeviceSnapshot registerDevice(GatewayDevice device, boolean persist) {
        DeviceSnapshot snapshot = updateCachedDevice(device, persist);
        String id = snapshot.getId();

        List<SubscriptionResult> results = new ArrayList<>();
        List<DeviceSubscription<?>> active = new ArrayList<>();
        registrationLock.lock();
        try {
            releaseAll(subscriptions.remove(id));
            for (NotificationSource<DeviceEventListener> source : listOrEmpty(device::eventSources)) {
                results.add(subscribe(id, source, eventCallback(id, source.name())));
            }
            for (NotificationSource<StateChangeListener> group : listOrEmpty(device::stateGroups)) {
                results.add(subscribe(id, group, stateCallback(id, group.name())));
            }
            for (SubscriptionResult r : results) {
                if (r.succeeded()) {
                    active.add(r.subscription());
                } else {
                    log.debug("subscribe_failed device={} source={}: {}", r.deviceId(), r.source(), r.failure().toString());
                }
            }
            if (!active.isEmpty()) subscriptions.put(id, active);
        } finally {
            registrationLock.unlock();
        }
        if (log.isDebugEnabled()) {
            log.debug("device_registered id={} callbacks={} failed={}", id, active.size(), results.size() - active.size());
        }
        return snapshot;
    }

    /** Releases the callbacks of a device; with {@code drop} also forgets handle and snapshot. */
    public void unregisterDevice(String deviceId, boolean drop) {
        String id = DeviceIds.normalize(deviceId);
        registrationLock.lock();
        try {
            releaseAll(subscriptions.remove(id));
        } finally {
            registrationLock.unlock();
        }
        if (!drop) return;

        liveDevices.remove(id);
        DeviceSnapshot removed;
        cacheLock.lock();
        try {
            removed = cache.remove(id);
            status.updateDeviceCount(cache.size());
        } finally {
            cacheLock.unlock();
        }
        if (removed != null) {
            persist();
            log.info("device_dropped id={}", id);
        }
    }

    /** Re-snapshot a live handle into the cache. */
    public DeviceSnapshot updateCachedDevice(GatewayDevice device, boolean persist) {
        DeviceSnapshot snapshot = DeviceSnapshots.of(device);
        String id = snapshot.getId();
        liveDevices.put(id, device);
        cacheLock.lock();
        try {
            cache.put(id, snapshot);
            status.updateDeviceCount(cache.size());
        } finally {
            cacheLock.unlock();
        }
        if (persist) persist();
        return snapshot;
    }

    // ---- Queries ----

    /** Fresh snapshots of live devices when connected; the cache otherwise or on failure. */
    public List<DeviceSnapshot> listDevices() {
        Gateway gw = gateway;
        if (gw != null) {
            try {
                List<DeviceSnapshot> out = new ArrayList<>();
                for (GatewayDevice d : List.copyOf(gw.devices())) {
                    if (isModem(gw, d)) continue;
                    out.add(updateCachedDevice(d, false));
                }
                return out;
            } catch (RuntimeException e) {
                log.debug("live_snapshot_failed, falling back to cache: {}", e.toString());
            }
        }
        return cachedDevices();
    }

    public DeviceSnapshot getDevice(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new DeviceNotFoundException("Device id required");
        }
        String id = DeviceIds.normalize(deviceId);
        Optional<GatewayDevice> live = findLiveDevice(id);
        if (live.isPresent()) return updateCachedDevice(live.get(), false);

        DeviceSnapshot cached = cache.get(id);
        if (cached != null) return cached;
        throw new DeviceNotFoundException("Insteon device " + deviceId + " not found");
    }

    /** Live handle by id, falling back to a search on the gateway. */
    public Optional<GatewayDevice> findLiveDevice(String deviceId) {
        String id = DeviceIds.normalize(deviceId);
        GatewayDevice known = liveDevices.get(id);
        if (known != null) return Optional.of(known);
        Gateway gw = gateway;
        if (gw == null) return Optional.empty();
        try {
            return gw.findDevice(id);
        } catch (RuntimeException e) {
            log.debug("gateway_search_failed id={}: {}", id, e.toString());
            return Optional.empty();
        }
    }

    public List<DeviceSnapshot> cachedDevices() {
        cacheLock.lock();
        try {
            return new ArrayList<>(cache.values());
        } finally {
            cacheLock.unlock();
        }
    }

    // ---- Discovery ----

    public DiscoveryResult runDiscovery(Boolean refresh) {
        boolean doRefresh = refresh != null ? refresh : settings.isDiscoveryRefreshDefault();
        Gateway gw = gateway;
        if (gw == null) {
            if (settings.isMockPermitted()) {
                log.info("discovery_offline: returning cached devices only");
                return DiscoveryResult.of(cachedDevices(), DiscoveryResult.MOCK);
            }
            throw new BridgeNotConnectedException("PLM not connected");
        }

        try {
            discoveryLock.lockInterruptibly();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new DiscoveryFailedException("Interrupted while waiting for a running discovery");
        }
        try {
            log.info("discovery_started refresh={} mode={}", doRefresh, modeName());
            try {
                gw.load(doRefresh).get();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new DiscoveryFailedException("Discovery interrupted");
            } catch (ExecutionException | RuntimeException e) {
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                log.error("discovery_failed: {}", cause.toString(), cause);
                throw new DiscoveryFailedException("Discovery failed: " + cause.getMessage(), cause);
            }

            List<DeviceSnapshot> snapshots = registerAll(gw);
            markDiscovery();
            persist();
            String mode = modeName();
            events.publish(BridgeEvent.discoveryComplete(snapshots, mode));
            log.info("discovery_complete devices={} mode={}", snapshots.size(), mode);
            return DiscoveryResult.of(snapshots, mode);
        } finally {
            discoveryLock.unlock();
        }
    }

    // ---- Notification routing ----

    /** Hand work to the notification executor. Safe from any thread. */
    public void handOff(Runnable work) {
        try {
            notificationExecutor.execute(work);
        } catch (RejectedExecutionException e) {
            log.debug("notification_rejected (shutting down?)");
        }
    }

    void processDeviceEvent(String deviceId, String event, int group, String button) {
        DeviceSnapshot snapshot = findLiveDevice(deviceId)
                .map(d -> updateCachedDevice(d, false))
                .orElse(null);
        events.publish(BridgeEvent.deviceEvent(deviceId, event, group, button, snapshot));
    }

    void processStateChange(String deviceId, String name, int group, Object value) {
        DeviceSnapshot snapshot = findLiveDevice(deviceId)
                .map(d -> updateCachedDevice(d, false))
                .orElse(null);
        events.publish(BridgeEvent.deviceState(deviceId, name, group, DeviceSnapshots.scalarOrNull(value), snapshot));
    }

    private DeviceEventListener eventCallback(String deviceId, String sourceName) {
        return (name, address, group, button) -> {
            String id = DeviceIds.normalize(deviceId);
            String event = name != null && !name.isEmpty() ? name : sourceName;
            String btn = button != null && !button.isEmpty() ? button : null;
            handOff(() -> processDeviceEvent(id, event, group, btn));
        };
    }

    private StateChangeListener stateCallback(String deviceId, String groupName) {
        return (name, address, value, group) -> {
            String id = DeviceIds.normalize(deviceId);
            String channel = name != null && !name.isEmpty() ? name : groupName;
            handOff(() -> processStateChange(id, channel, group, value));
        };
    }

    // ---- internals ----

    private List<DeviceSnapshot> registerAll(Gateway gw) {
        List<GatewayDevice> devices;
        try {
            devices = List.copyOf(gw.devices());
        } catch (RuntimeException e) {
            log.warn("gateway_device_list_failed: {}", e.toString());
            devices = List.of();
        }
        List<DeviceSnapshot> snapshots = new ArrayList<>();
        for (GatewayDevice d : devices) {
            if (isModem(gw, d)) continue;
            snapshots.add(registerDevice(d, false));
        }
        return snapshots;
    }

    private void markDiscovery() {
        cacheLock.lock();
        try {
            status.recordDiscovery(cache.size(), Instant.now());
        } finally {
            cacheLock.unlock();
        }
    }

    private void persist() {
        try {
            store.save(cachedDevices());
        } catch (CachePersistenceException e) {
            log.warn("cache_persist_failed path={}: {}", store.path(), rootMessage(e));
        }
    }

    private <L> SubscriptionResult subscribe(String deviceId, NotificationSource<L> source, L listener) {
        try {
            source.subscribe(listener);
            return SubscriptionResult.ok(deviceId, new DeviceSubscription<>(source, listener));
        } catch (Exception e) {
            return SubscriptionResult.failed(deviceId, safeName(source), e);
        }
    }

    private void clearSubscriptions() {
        registrationLock.lock();
        try {
            for (String id : List.copyOf(subscriptions.keySet())) {
                releaseAll(subscriptions.remove(id));
            }
        } finally {
            registrationLock.unlock();
        }
    }

    private static void releaseAll(List<DeviceSubscription<?>> subs) {
        if (subs == null) return;
        for (DeviceSubscription<?> s : subs) {
            try {
                s.release();
            } catch (Exception e) {
                log.debug("unsubscribe_failed source={}: {}", s.describe(), e.toString());
            }
        }
    }

    private static boolean isModem(Gateway gw, GatewayDevice device) {
        try {
            return gw.modem()
                    .map(m -> DeviceIds.sameDevice(m.address(), device.address()))
                    .orElse(false);
        } catch (RuntimeException e) {
            return false;
        }
    }

    private static <T> List<T> listOrEmpty(Supplier<? extends Collection<? extends T>> getter) {
        try {
            Collection<? extends T> c = getter.get();
            return c == null ? List.of() : new ArrayList<>(c);
        } catch (RuntimeException e) {
            log.debug("device_sources_unavailable: {}", e.toString());
            return List.of();
        }
    }

    private static String safeName(NotificationSource<?> source) {
        try {
            return source.name();
        } catch (RuntimeException e) {
            return "?";
        }
    }

    private String modeName() {
        return mockMode ? DiscoveryResult.MOCK : DiscoveryResult.LIVE;
    }

    private static String rootMessage(Throwable e) {
        Throwable c = e;
        while (c.getCause() != null) c = c.getCause();
        return c == e ? String.valueOf(e.getMessage()) : e.getMessage() + " (" + c + ")";
    }
}
