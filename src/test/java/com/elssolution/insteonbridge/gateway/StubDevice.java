package com.elssolution.insteonbridge.gateway;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Hand-built device handle for registry and dispatcher tests. */
public class StubDevice implements GatewayDevice {

    private final String address;
    public final Map<String, Object> states = new LinkedHashMap<>();
    public final List<StubSource<DeviceEventListener>> events = new ArrayList<>();
    public final List<StubSource<StateChangeListener>> groups = new ArrayList<>();
    public final Map<String, DeviceOperation> operations = new LinkedHashMap<>();

    public StubDevice(String address) {
        this.address = address;
    }

    @Override public String address() { return address; }

    @Override public Map<String, Object> states() { return states; }

    @Override public List<StubSource<DeviceEventListener>> eventSources() { return events; }

    @Override public List<StubSource<StateChangeListener>> stateGroups() { return groups; }

    @Override
    public Optional<DeviceOperation> operation(String name) {
        return Optional.ofNullable(operations.get(name));
    }
}
