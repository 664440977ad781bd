package io.schedula.core.cursor;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

public final class FileSchedulerStateStore implements SchedulerStateStore {
    private final Path path;
    private final ObjectMapper mapper = new ObjectMapper();

    public FileSchedulerStateStore(Path path) {
        this.path = path;
    }

    @Override
    public synchronized SchedulerState.Snapshot load() throws IOException {
        if (!Files.exists(path)) {
            return new SchedulerState.Snapshot(Map.of(), Map.of());
        }
        return mapper.readValue(Files.readString(path), SchedulerState.Snapshot.class);
    }

    @Override
    public synchronized void save(SchedulerState.Snapshot snapshot) throws IOException {
        Files.createDirectories(path.getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
