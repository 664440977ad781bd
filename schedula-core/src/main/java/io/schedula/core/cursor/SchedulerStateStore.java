package io.schedula.core.cursor;

import java.io.IOException;

public interface SchedulerStateStore {
    SchedulerState.Snapshot load() throws IOException;

    void save(SchedulerState.Snapshot snapshot) throws IOException;
}
