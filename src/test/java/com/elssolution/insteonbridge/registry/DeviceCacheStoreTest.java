package com.elssolution.insteonbridge.registry;

import com.elssolution.insteonbridge.domain.Capability;
import com.elssolution.insteonbridge.domain.DeviceSnapshot;
import com.elssolution.insteonbridge.exception.CachePersistenceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeviceCacheStoreTest {

    @TempDir Path dir;

    private static DeviceSnapshot snapshot(String id, int level) {
        return DeviceSnapshot.builder()
                .id(id).address(id).name("Lamp " + id)
                .category(1).subcategory(0x20)
                .capabilities(List.of(Capability.DIMMER))
                .state(Map.of("level", level))
                .raw(Map.of("cat", "0x01"))
                .build();
    }

    @Test
    void missingFileIsEmptyCache() {
        DeviceCacheStore store = new DeviceCacheStore(dir.resolve("nope.json"));

        assertThat(store.load()).isEmpty();
    }

    @Test
    void savedSnapshotsComeBackKeyedById() {
        Path file = dir.resolve("sub/devices.json");
        DeviceCacheStore store = new DeviceCacheStore(file);

        store.save(List.of(snapshot("bbbbbb", 10), snapshot("aaaaaa", 255)));
        Map<String, DeviceSnapshot> loaded = store.load();

        assertThat(loaded).containsOnlyKeys("aaaaaa", "bbbbbb");
        assertThat(loaded.get("aaaaaa").getState()).containsEntry("level", 255);
        assertThat(loaded.get("bbbbbb").getCapabilities()).containsExactly(Capability.DIMMER);
        assertThat(Files.exists(dir.resolve("sub/devices.json.tmp"))).isFalse();
    }

    @Test
    void fileIsSortedByIdWithTwoSpaceIndent() throws Exception {
        Path file = dir.resolve("devices.json");
        new DeviceCacheStore(file).save(List.of(snapshot("cccccc", 1), snapshot("aaaaaa", 1)));

        String json = Files.readString(file);

        assertThat(json.indexOf("\"aaaaaa\"")).isLessThan(json.indexOf("\"cccccc\""));
        assertThat(json).startsWith("{\n  \"devices\"");
    }

    @Test
    void legacyEntriesAreNormalizedAndBadOnesSkipped() throws Exception {
        Path file = dir.resolve("devices.json");
        Files.writeString(file, """
                {"devices": [
                  {"id": "AA.BB.CC", "name": "Hall", "capabilities": ["dimmer"], "extra": 1},
                  {"name": "no id"},
                  {"id": "dd.ee.ff", "capabilities": ["teleport"]},
                  "garbage"
                ]}
                """);

        Map<String, DeviceSnapshot> loaded = new DeviceCacheStore(file).load();

        assertThat(loaded).containsOnlyKeys("aabbcc");
        assertThat(loaded.get("aabbcc").getAddress()).isEqualTo("aabbcc");
    }

    @Test
    void bareArrayIsAccepted() throws Exception {
        Path file = dir.resolve("devices.json");
        Files.writeString(file, "[{\"id\": \"112233\"}]");

        assertThat(new DeviceCacheStore(file).load()).containsOnlyKeys("112233");
    }

    @Test
    void unreadableJsonIsAPersistenceError() throws Exception {
        Path file = dir.resolve("devices.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> new DeviceCacheStore(file).load())
                .isInstanceOf(CachePersistenceException.class);
    }
}
