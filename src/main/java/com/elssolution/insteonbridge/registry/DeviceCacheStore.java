package com.elssolution.insteonbridge.registry;

import com.elssolution.insteonbridge.config.BridgeSettings;
import com.elssolution.insteonbridge.domain.DeviceIds;
import com.elssolution.insteonbridge.domain.DeviceSnapshot;
import com.elssolution.insteonbridge.exception.CachePersistenceException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON file behind the device cache: {@code {"devices": [snapshot, ...]}}.
 * Writes go to a sibling temp file that is renamed over the target.
 */
@Slf4j
@Component
public class DeviceCacheStore {

    private final Path path;
    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    @Autowired
    public DeviceCacheStore(BridgeSettings settings) {
        this(settings.cacheFile());
    }

    public DeviceCacheStore(Path path) {
        this.path = path;
        this.mapper = JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withObjectIndenter(new DefaultIndenter("  ", "\n"));
        printer.indentArraysWith(new DefaultIndenter("  ", "\n"));
        this.writer = mapper.writer(printer);
    }

    public Path path() {
        return path;
    }

    /**
     * Reads the cache. Ids and addresses are normalized; the last entry per id wins.
     * A missing file is an empty cache.
     */
    public Map<String, DeviceSnapshot> load() {
        Map<String, DeviceSnapshot> out = new LinkedHashMap<>();
        if (!Files.isRegularFile(path)) return out;

        JsonNode root;
        try {
            root = mapper.readTree(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CachePersistenceException("Cannot read device cache " + path, e);
        }
        JsonNode devices = root != null && root.isObject() ? root.path("devices") : root;
        if (devices == null || !devices.isArray()) return out;

        int skipped = 0;
        for (JsonNode entry : devices) {
            if (!entry.isObject() || !entry.hasNonNull("id")) {
                skipped++;
                continue;
            }
            try {
                DeviceSnapshot snap = mapper.treeToValue(entry, DeviceSnapshot.class).normalized();
                out.put(DeviceIds.normalize(snap.getId()), snap);
            } catch (IOException | IllegalArgumentException e) {
                skipped++;
                log.debug("cache_entry_skipped id={}: {}", entry.path("id").asText(), e.getMessage());
            }
        }
        if (skipped > 0) log.warn("cache_entries_skipped count={} path={}", skipped, path);
        return out;
    }

    /** Serializes all snapshots (sorted by id, keys sorted, 2-space indent) and swaps the file in. */
    public synchronized void save(Collection<DeviceSnapshot> snapshots) {
        List<DeviceSnapshot> sorted = new ArrayList<>(snapshots);
        sorted.sort(Comparator.comparing(DeviceSnapshot::getId));
        Map<String, Object> payload = Map.of("devices", sorted);

        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(tmp, writer.writeValueAsString(payload) + "\n", StandardCharsets.UTF_8);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new CachePersistenceException("Cannot write device cache " + path, e);
        }
        if (log.isDebugEnabled()) log.debug("cache_persisted devices={} path={}", sorted.size(), path);
    }
}
