package io.schedula.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each list as one JSON array file under a root directory. Keys map to relative paths
 * ({@code logs/events/e1} becomes {@code logs/events/e1.json}); expirations live in {@code _expires.json}.
 */
public final class FileListStore implements ListStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileListStore.class);
    private static final TypeReference<List<Map<String, Object>>> ITEMS = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Long>> EXPIRES = new TypeReference<>() {
    };

    private final Path root;
    private final ObjectMapper mapper = new ObjectMapper();

    public FileListStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public synchronized ListPage<Map<String, Object>> listGet(String key, int offset, int limit) throws IOException {
        List<Map<String, Object>> items = loadExisting(key);
        int from = Math.min(Math.max(0, offset), items.size());
        int to = limit <= 0 ? items.size() : Math.min(items.size(), from + limit);
        return new ListPage<>(items.subList(from, to), items.size());
    }

    @Override
    public synchronized Map<String, Object> listFind(String key, Map<String, Object> criteria) throws IOException {
        for (Map<String, Object> item : loadExisting(key)) {
            if (ListStore.matches(item, criteria)) {
                return item;
            }
        }
        throw new StoreKeyNotFoundException("No item in " + key + " matching " + criteria);
    }

    @Override
    public synchronized void listUnshift(String key, Map<String, Object> item) throws IOException {
        Path path = pathFor(key);
        List<Map<String, Object>> items = Files.exists(path) ? read(path) : new ArrayList<>();
        items.add(0, new LinkedHashMap<>(item));
        write(path, items);
    }

    @Override
    public synchronized void listFindUpdate(String key, Map<String, Object> criteria, Map<String, Object> updates)
        throws IOException {
        List<Map<String, Object>> items = loadExisting(key);
        for (Map<String, Object> item : items) {
            if (ListStore.matches(item, criteria)) {
                item.putAll(updates);
                write(pathFor(key), items);
                return;
            }
        }
        throw new StoreKeyNotFoundException("No item in " + key + " matching " + criteria);
    }

    @Override
    public synchronized Map<String, Object> listFindDelete(String key, Map<String, Object> criteria) throws IOException {
        List<Map<String, Object>> items = loadExisting(key);
        Iterator<Map<String, Object>> iterator = items.iterator();
        while (iterator.hasNext()) {
            Map<String, Object> item = iterator.next();
            if (ListStore.matches(item, criteria)) {
                iterator.remove();
                write(pathFor(key), items);
                return item;
            }
        }
        throw new StoreKeyNotFoundException("No item in " + key + " matching " + criteria);
    }

    @Override
    public synchronized void expire(String key, long atEpochSeconds) throws IOException {
        Map<String, Long> expires = loadExpires();
        expires.put(key, atEpochSeconds);
        saveExpires(expires);
    }

    @Override
    public synchronized int purgeExpired(long nowEpochSeconds) throws IOException {
        Map<String, Long> expires = loadExpires();
        int purged = 0;
        Iterator<Map.Entry<String, Long>> iterator = expires.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Long> entry = iterator.next();
            if (entry.getValue() <= nowEpochSeconds) {
                if (Files.deleteIfExists(pathFor(entry.getKey()))) {
                    purged++;
                }
                iterator.remove();
            }
        }
        saveExpires(expires);
        if (purged > 0) {
            LOG.debug("Purged {} expired lists", purged);
        }
        return purged;
    }

    private List<Map<String, Object>> loadExisting(String key) throws IOException {
        Path path = pathFor(key);
        if (!Files.exists(path)) {
            throw new StoreKeyNotFoundException("List not found: " + key);
        }
        return read(path);
    }

    private List<Map<String, Object>> read(Path path) throws IOException {
        return new ArrayList<>(mapper.readValue(Files.readString(path), ITEMS));
    }

    private void write(Path path, Object value) throws IOException {
        Files.createDirectories(path.getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private Map<String, Long> loadExpires() throws IOException {
        Path path = root.resolve("_expires.json");
        if (!Files.exists(path)) {
            return new LinkedHashMap<>();
        }
        return new LinkedHashMap<>(mapper.readValue(Files.readString(path), EXPIRES));
    }

    private void saveExpires(Map<String, Long> expires) throws IOException {
        write(root.resolve("_expires.json"), expires);
    }

    private Path pathFor(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        String safe = key.replaceAll("[^A-Za-z0-9_/.-]", "_");
        Path path = root.resolve(safe + ".json").normalize();
        if (!path.startsWith(root) || safe.contains("..")) {
            throw new IllegalArgumentException("key escapes store root: " + key);
        }
        return path;
    }
}
