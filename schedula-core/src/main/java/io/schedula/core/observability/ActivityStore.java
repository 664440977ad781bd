package io.schedula.core.observability;

import java.io.IOException;
import java.util.List;

public interface ActivityStore {
    List<ActivityEvent> load() throws IOException;

    void save(List<ActivityEvent> events) throws IOException;
}
