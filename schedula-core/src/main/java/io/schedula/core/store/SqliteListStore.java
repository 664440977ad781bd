package io.schedula.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SqliteListStore implements ListStore {
    private static final TypeReference<LinkedHashMap<String, Object>> ITEM = new TypeReference<>() {
    };

    private final String jdbcUrl;
    private final ObjectMapper mapper = new ObjectMapper();

    public SqliteListStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        init();
    }

    @Override
    public synchronized ListPage<Map<String, Object>> listGet(String key, int offset, int limit) throws IOException {
        try (Connection connection = openConnection()) {
            requireList(connection, key);
            int length = count(connection, key);
            String sql = """
                SELECT item_json FROM list_items
                WHERE list_key = ?
                ORDER BY position ASC
                LIMIT ? OFFSET ?
                """;
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, key);
                statement.setInt(2, limit <= 0 ? -1 : limit);
                statement.setInt(3, Math.max(0, offset));
                List<Map<String, Object>> items = new ArrayList<>();
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        items.add(mapper.readValue(resultSet.getString("item_json"), ITEM));
                    }
                }
                return new ListPage<>(items, length);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read list " + key, e);
        }
    }

    @Override
    public synchronized Map<String, Object> listFind(String key, Map<String, Object> criteria) throws IOException {
        try (Connection connection = openConnection()) {
            requireList(connection, key);
            return findRow(connection, key, criteria).item();
        } catch (SQLException e) {
            throw new IOException("Failed to search list " + key, e);
        }
    }

    @Override
    public synchronized void listUnshift(String key, Map<String, Object> item) throws IOException {
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement createList = connection.prepareStatement(
                     "INSERT OR IGNORE INTO lists (list_key) VALUES (?)");
                 PreparedStatement head = connection.prepareStatement(
                     "SELECT COALESCE(MIN(position), 0) AS head FROM list_items WHERE list_key = ?");
                 PreparedStatement insert = connection.prepareStatement(
                     "INSERT INTO list_items (list_key, position, item_json) VALUES (?, ?, ?)")) {
                createList.setString(1, key);
                createList.executeUpdate();
                head.setString(1, key);
                long position;
                try (ResultSet resultSet = head.executeQuery()) {
                    position = resultSet.next() ? resultSet.getLong("head") - 1 : -1;
                }
                insert.setString(1, key);
                insert.setLong(2, position);
                insert.setString(3, mapper.writeValueAsString(item));
                insert.executeUpdate();
                connection.commit();
            } catch (SQLException | IOException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to insert into list " + key, e);
        }
    }

    @Override
    public synchronized void listFindUpdate(String key, Map<String, Object> criteria, Map<String, Object> updates)
        throws IOException {
        try (Connection connection = openConnection()) {
            requireList(connection, key);
            Row row = findRow(connection, key, criteria);
            Map<String, Object> merged = new LinkedHashMap<>(row.item());
            merged.putAll(updates);
            try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE list_items SET item_json = ? WHERE list_key = ? AND position = ?")) {
                statement.setString(1, mapper.writeValueAsString(merged));
                statement.setString(2, key);
                statement.setLong(3, row.position());
                statement.executeUpdate();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to update list " + key, e);
        }
    }

    @Override
    public synchronized Map<String, Object> listFindDelete(String key, Map<String, Object> criteria) throws IOException {
        try (Connection connection = openConnection()) {
            requireList(connection, key);
            Row row = findRow(connection, key, criteria);
            try (PreparedStatement statement = connection.prepareStatement(
                "DELETE FROM list_items WHERE list_key = ? AND position = ?")) {
                statement.setString(1, key);
                statement.setLong(2, row.position());
                statement.executeUpdate();
            }
            return row.item();
        } catch (SQLException e) {
            throw new IOException("Failed to delete from list " + key, e);
        }
    }

    @Override
    public synchronized void expire(String key, long atEpochSeconds) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(
                 "INSERT OR REPLACE INTO list_expires (list_key, expires_at) VALUES (?, ?)")) {
            statement.setString(1, key);
            statement.setLong(2, atEpochSeconds);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to set expiry for " + key, e);
        }
    }

    @Override
    public synchronized int purgeExpired(long nowEpochSeconds) throws IOException {
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            List<String> keys = new ArrayList<>();
            try (PreparedStatement select = connection.prepareStatement(
                "SELECT list_key FROM list_expires WHERE expires_at <= ?")) {
                select.setLong(1, nowEpochSeconds);
                try (ResultSet resultSet = select.executeQuery()) {
                    while (resultSet.next()) {
                        keys.add(resultSet.getString("list_key"));
                    }
                }
            }
            int purged = 0;
            try (PreparedStatement items = connection.prepareStatement("DELETE FROM list_items WHERE list_key = ?");
                 PreparedStatement lists = connection.prepareStatement("DELETE FROM lists WHERE list_key = ?");
                 PreparedStatement expires = connection.prepareStatement("DELETE FROM list_expires WHERE list_key = ?")) {
                for (String key : keys) {
                    items.setString(1, key);
                    items.executeUpdate();
                    lists.setString(1, key);
                    purged += lists.executeUpdate();
                    expires.setString(1, key);
                    expires.executeUpdate();
                }
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
            return purged;
        } catch (SQLException e) {
            throw new IOException("Failed to purge expired lists", e);
        }
    }

    private Row findRow(Connection connection, String key, Map<String, Object> criteria)
        throws SQLException, IOException {
        String sql = "SELECT position, item_json FROM list_items WHERE list_key = ? ORDER BY position ASC";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, key);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    Map<String, Object> item = mapper.readValue(resultSet.getString("item_json"), ITEM);
                    if (ListStore.matches(item, criteria)) {
                        return new Row(resultSet.getLong("position"), item);
                    }
                }
            }
        }
        throw new StoreKeyNotFoundException("No item in " + key + " matching " + criteria);
    }

    private void requireList(Connection connection, String key) throws SQLException, StoreKeyNotFoundException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT 1 FROM lists WHERE list_key = ?")) {
            statement.setString(1, key);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    throw new StoreKeyNotFoundException("List not found: " + key);
                }
            }
        }
    }

    private int count(Connection connection, String key) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT COUNT(*) AS total FROM list_items WHERE list_key = ?")) {
            statement.setString(1, key);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? resultSet.getInt("total") : 0;
            }
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute("""
                CREATE TABLE IF NOT EXISTS lists (
                    list_key TEXT PRIMARY KEY
                )
                """);
            statement.execute("""
                CREATE TABLE IF NOT EXISTS list_items (
                    list_key TEXT NOT NULL,
                    position INTEGER NOT NULL,
                    item_json TEXT NOT NULL,
                    PRIMARY KEY (list_key, position)
                )
                """);
            statement.execute("""
                CREATE TABLE IF NOT EXISTS list_expires (
                    list_key TEXT PRIMARY KEY,
                    expires_at INTEGER NOT NULL
                )
                """);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite list store", e);
        }
    }

    private record Row(long position, Map<String, Object> item) {
    }
}
