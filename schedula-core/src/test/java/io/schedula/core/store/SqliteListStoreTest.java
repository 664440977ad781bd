package io.schedula.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteListStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldKeepNewestFirstAndPaginate() throws Exception {
        SqliteListStore store = new SqliteListStore(tempDir.resolve("schedula.db"));
        store.listUnshift("global/schedule", Map.of("id", "a"));
        store.listUnshift("global/schedule", Map.of("id", "b"));
        store.listUnshift("global/schedule", Map.of("id", "c"));

        ListPage<Map<String, Object>> page = store.listGet("global/schedule", 1, 1);

        assertThat(page.length()).isEqualTo(3);
        assertThat(page.items()).extracting(item -> item.get("id")).containsExactly("b");
        assertThat(store.listGet("global/schedule", 0, 0).items()).extracting(item -> item.get("id"))
            .containsExactly("c", "b", "a");
    }

    @Test
    void shouldPersistAcrossStoreInstances() throws Exception {
        Path db = tempDir.resolve("schedula.db");
        SqliteListStore first = new SqliteListStore(db);
        first.listUnshift("global/schedule", Map.of("id", "a", "title", "A"));
        first.listFindUpdate("global/schedule", Map.of("id", "a"), Map.of("title", "A2"));

        SqliteListStore second = new SqliteListStore(db);

        assertThat(second.listFind("global/schedule", Map.of("id", "a"))).containsEntry("title", "A2");
        assertThat(second.listFindDelete("global/schedule", Map.of("id", "a"))).containsEntry("id", "a");
        assertThat(second.listGet("global/schedule", 0, 10).items()).isEmpty();
    }

    @Test
    void shouldSignalMissingListsAndItems() throws Exception {
        SqliteListStore store = new SqliteListStore(tempDir.resolve("schedula.db"));

        assertThatThrownBy(() -> store.listGet("nope", 0, 10)).isInstanceOf(StoreKeyNotFoundException.class);
        store.listUnshift("list", Map.of("id", "a"));
        assertThatThrownBy(() -> store.listFind("list", Map.of("id", "z"))).isInstanceOf(StoreKeyNotFoundException.class);
        assertThatThrownBy(() -> store.listFindDelete("list", Map.of("id", "z"))).isInstanceOf(StoreKeyNotFoundException.class);
    }

    @Test
    void shouldPurgeExpiredLists() throws Exception {
        SqliteListStore store = new SqliteListStore(tempDir.resolve("schedula.db"));
        store.listUnshift("logs/events/e1", Map.of("id", "j1"));
        store.expire("logs/events/e1", 1_000);

        assertThat(store.purgeExpired(999)).isZero();
        assertThat(store.purgeExpired(1_000)).isEqualTo(1);
        assertThatThrownBy(() -> store.listGet("logs/events/e1", 0, 10)).isInstanceOf(StoreKeyNotFoundException.class);
    }
}
