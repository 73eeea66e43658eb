package com.elssolution.insteonbridge.domain;

import com.elssolution.insteonbridge.gateway.GatewayDevice;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Converts live {@link GatewayDevice} handles into {@link DeviceSnapshot}s.
 *
 * Drivers are allowed to be sloppy: any accessor may throw, and a failing accessor
 * just leaves the corresponding field empty.
 */
@Slf4j
public final class DeviceSnapshots {

    private DeviceSnapshots() {
    }

    public static DeviceSnapshot of(GatewayDevice device) {
        String id = DeviceIds.normalize(safe(device::address).orElse(null));
        Optional<Integer> category = safeOpt(device::category);
        Optional<Integer> subcategory = safeOpt(device::subcategory);
        Optional<String> firmware = safeOpt(device::firmware);
        Map<String, Object> state = extractState(device);

        return DeviceSnapshot.builder()
                .id(id)
                .address(id)
                .name(safeOpt(device::name)
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .orElse("Insteon " + id.toUpperCase(Locale.ROOT)))
                .category(category.orElse(null))
                .subcategory(subcategory.orElse(null))
                .productKey(safeOpt(device::productKey).orElse(null))
                .firmware(firmware.orElse(null))
                .capabilities(extractCapabilities(device, state))
                .state(state)
                .lastSeen(safeOpt(device::lastSeen)
                        .map(t -> OffsetDateTime.ofInstant(t, ZoneId.systemDefault()).toString())
                        .orElse(null))
                .raw(rawMeta(device, category, subcategory, firmware))
                .build();
    }

    static List<Capability> extractCapabilities(GatewayDevice device, Map<String, Object> state) {
        Set<Capability> caps = EnumSet.noneOf(Capability.class);
        safe(() -> {
            for (Capability c : device.declaredCapabilities()) {
                if (c != null) caps.add(c);
            }
            return caps;
        });
        for (String key : state.keySet()) {
            String k = key.toLowerCase(Locale.ROOT);
            if (k.startsWith("level")) caps.add(Capability.DIMMER);
            else if (k.startsWith("on_off")) caps.add(Capability.SWITCH);
        }
        List<Capability> out = new ArrayList<>(caps);
        out.sort(Comparator.comparing(Capability::label));
        return out;
    }

    static Map<String, Object> extractState(GatewayDevice device) {
        Map<String, Object> out = new LinkedHashMap<>();
        Map<String, Object> states = safe(device::states).orElse(Map.of());
        states.forEach((key, value) -> {
            if (key == null) return;
            if (value == null) {
                out.put(key, null);
                return;
            }
            Object scalar = scalarOrNull(value);
            if (scalar != null) out.put(key, scalar);
        });
        return out;
    }

    /** Integer, Double, String or Boolean; anything else is not a state value and maps to null. */
    public static Object scalarOrNull(Object value) {
        if (value instanceof Boolean || value instanceof String) return value;
        if (value instanceof Byte || value instanceof Short || value instanceof Integer) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long l) {
            return (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) ? (Object) l.intValue() : l;
        }
        if (value instanceof Float || value instanceof Double) return ((Number) value).doubleValue();
        if (value instanceof Enum<?> e) return e.name();
        return null;
    }

    private static Map<String, String> rawMeta(GatewayDevice device,
                                               Optional<Integer> category,
                                               Optional<Integer> subcategory,
                                               Optional<String> firmware) {
        Map<String, String> raw = new LinkedHashMap<>();
        safeOpt(device::model).ifPresent(v -> raw.put("model", v));
        category.ifPresent(v -> raw.put("cat", String.format("0x%02x", v)));
        subcategory.ifPresent(v -> raw.put("subcat", String.format("0x%02x", v)));
        firmware.ifPresent(v -> raw.put("firmware_version", v));
        return raw;
    }

    private static <T> Optional<T> safe(Supplier<T> getter) {
        try {
            return Optional.ofNullable(getter.get());
        } catch (RuntimeException e) {
            log.debug("device accessor failed: {}", e.toString());
            return Optional.empty();
        }
    }

    private static <T> Optional<T> safeOpt(Supplier<Optional<T>> getter) {
        return safe(getter).flatMap(o -> o);
    }
}
