package io.schedula.core.job;

import static org.assertj.core.api.Assertions.assertThat;

import io.schedula.core.store.FileListStore;
import io.schedula.core.store.ListPage;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobHistoryServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReturnEmptyPagesWhenNothingCompleted() throws Exception {
        JobHistoryService history = new JobHistoryService(new FileListStore(tempDir));

        assertThat(history.history(0, 0).items()).isEmpty();
        assertThat(history.eventHistory("e1", 0, 0).length()).isZero();
    }

    @Test
    void shouldRecordCompletionsPerEventAndGlobally() throws Exception {
        JobHistoryService history = new JobHistoryService(new FileListStore(tempDir));

        history.recordCompletion(Map.of("id", "j1", "event", "e1", "code", 0));
        history.recordCompletion(Map.of("id", "j2", "event", "e2", "code", 1));
        history.recordCompletion(Map.of("id", "j3", "event", "e1", "code", 0));
        history.recordCompletion(Map.of("id", "j4"));

        ListPage<Map<String, Object>> e1 = history.eventHistory("e1", 0, 0);
        assertThat(e1.items()).extracting(row -> row.get("id")).containsExactly("j3", "j1");
        ListPage<Map<String, Object>> all = history.history(1, 2);
        assertThat(all.length()).isEqualTo(4);
        assertThat(all.items()).extracting(row -> row.get("id")).containsExactly("j3", "j2");
    }
}
