package com.elssolution.insteonbridge.gateway;

import com.elssolution.insteonbridge.domain.Capability;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Live device handle. Device models differ in what they expose, so everything except
 * the address is optional and callers probe for it.
 */
public interface GatewayDevice {

    String address();

    default Optional<String> name() {
        return Optional.empty();
    }

    default Optional<Integer> category() {
        return Optional.empty();
    }

    default Optional<Integer> subcategory() {
        return Optional.empty();
    }

    default Optional<String> productKey() {
        return Optional.empty();
    }

    default Optional<String> firmware() {
        return Optional.empty();
    }

    default Optional<String> model() {
        return Optional.empty();
    }

    /** Capability flags the driver reports directly. */
    default Set<Capability> declaredCapabilities() {
        return Set.of();
    }

    /** State channel name to current value. Non-scalar values are dropped by snapshots. */
    default Map<String, Object> states() {
        return Map.of();
    }

    default Optional<Instant> lastSeen() {
        return Optional.empty();
    }

    default Collection<? extends NotificationSource<DeviceEventListener>> eventSources() {
        return List.of();
    }

    default Collection<? extends NotificationSource<StateChangeListener>> stateGroups() {
        return List.of();
    }

    /** Looks up a capability method by name, e.g. "turn_on" or "async_status_request". */
    default Optional<DeviceOperation> operation(String name) {
        return Optional.empty();
    }
}
