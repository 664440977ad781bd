package io.schedula.core.observability;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FileActivityStore implements ActivityStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileActivityStore.class);

    private final Path path;
    private final ObjectMapper mapper;

    public FileActivityStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    @Override
    public synchronized List<ActivityEvent> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            return mapper.readValue(Files.readString(path), new TypeReference<List<ActivityEvent>>() {
            });
        } catch (IOException e) {
            // a corrupt log starts over rather than blocking every mutation
            LOG.warn("Activity log {} is unreadable, starting a new one: {}", path, e.getMessage());
            return List.of();
        }
    }

    @Override
    public synchronized void save(List<ActivityEvent> events) throws IOException {
        Files.createDirectories(path.getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(events);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
