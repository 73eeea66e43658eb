package com.elssolution.insteonbridge.domain;

import com.elssolution.insteonbridge.gateway.GatewayDevice;
import com.elssolution.insteonbridge.gateway.StubDevice;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceSnapshotsTest {

    @Test
    void idIsNormalizedAndNameDefaultsToUpperCaseId() {
        DeviceSnapshot snap = DeviceSnapshots.of(new StubDevice("1A.2B.3C"));

        assertThat(snap.getId()).isEqualTo("1a2b3c");
        assertThat(snap.getAddress()).isEqualTo("1a2b3c");
        assertThat(snap.getName()).isEqualTo("Insteon 1A2B3C");
    }

    @Test
    void capabilitiesAreInferredFromStateChannelsAndSorted() {
        StubDevice device = new StubDevice("11.22.33") {
            @Override public Set<Capability> declaredCapabilities() { return Set.of(Capability.STATUS_QUERY); }
        };
        device.states.put("level", 128);
        device.states.put("on_off_2", true);

        DeviceSnapshot snap = DeviceSnapshots.of(device);

        assertThat(snap.getCapabilities())
                .containsExactly(Capability.DIMMER, Capability.STATUS_QUERY, Capability.SWITCH);
    }

    @Test
    void nullDeclaredCapabilitiesAreSkipped() {
        StubDevice device = new StubDevice("11.22.33") {
            @Override public Set<Capability> declaredCapabilities() {
                Set<Capability> caps = new HashSet<>();
                caps.add(null);
                caps.add(Capability.FAST_ON);
                return caps;
            }
        };

        assertThat(DeviceSnapshots.of(device).getCapabilities()).containsExactly(Capability.FAST_ON);
    }

    @Test
    void nullCapabilitySetIsTolerated() {
        StubDevice device = new StubDevice("11.22.33") {
            @Override public Set<Capability> declaredCapabilities() { return null; }
        };
        device.states.put("level", 0);

        assertThat(DeviceSnapshots.of(device).getCapabilities()).containsExactly(Capability.DIMMER);
    }

    @Test
    void nonScalarStateValuesAreDroppedButNullsKept() {
        StubDevice device = new StubDevice("11.22.33");
        device.states.put("level", 200L);
        device.states.put("temperature", 21.5f);
        device.states.put("mode", Thread.State.RUNNABLE);
        device.states.put("history", List.of(1, 2, 3));
        device.states.put("battery", null);

        Map<String, Object> state = DeviceSnapshots.of(device).getState();

        assertThat(state).containsEntry("level", 200)
                .containsEntry("temperature", 21.5d)
                .containsEntry("mode", "RUNNABLE")
                .containsEntry("battery", null)
                .doesNotContainKey("history");
    }

    @Test
    void failingAccessorsLeaveFieldsEmpty() {
        GatewayDevice flaky = new StubDevice("44.55.66") {
            @Override public Optional<String> name() { throw new IllegalStateException("not loaded"); }

            @Override public Optional<Integer> category() { throw new IllegalStateException("not loaded"); }
        };

        DeviceSnapshot snap = DeviceSnapshots.of(flaky);

        assertThat(snap.getName()).isEqualTo("Insteon 445566");
        assertThat(snap.getCategory()).isNull();
        assertThat(snap.getRaw()).doesNotContainKey("cat");
    }

    @Test
    void rawMetadataUsesHexCategoryCodes() {
        GatewayDevice device = new StubDevice("44.55.66") {
            @Override public Optional<Integer> category() { return Optional.of(1); }

            @Override public Optional<Integer> subcategory() { return Optional.of(0x2a); }

            @Override public Optional<String> model() { return Optional.of("2477D"); }

            @Override public Optional<String> firmware() { return Optional.of("0x45"); }

            @Override public Optional<Instant> lastSeen() { return Optional.of(Instant.EPOCH); }
        };

        DeviceSnapshot snap = DeviceSnapshots.of(device);

        assertThat(snap.getRaw()).containsEntry("cat", "0x01")
                .containsEntry("subcat", "0x2a")
                .containsEntry("model", "2477D")
                .containsEntry("firmware_version", "0x45");
        assertThat(snap.getLastSeen()).isNotNull();
    }

    @Test
    void onStateFollowsLevelBeforeOnOff() {
        DeviceSnapshot dimmedOff = DeviceSnapshot.builder().state(Map.of("level", 0, "on_off", true)).build();
        DeviceSnapshot switchedOn = DeviceSnapshot.builder().state(Map.of("on_off", true)).build();
        DeviceSnapshot nothing = DeviceSnapshot.builder().state(Map.of()).build();

        assertThat(dimmedOff.isOn()).isFalse();
        assertThat(switchedOn.isOn()).isTrue();
        assertThat(nothing.isOn()).isFalse();
    }
}
