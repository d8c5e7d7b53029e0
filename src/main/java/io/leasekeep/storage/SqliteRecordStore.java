package io.leasekeep.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Optional;
import java.util.function.UnaryOperator;

public final class SqliteRecordStore implements RecordStore {
    private static final int MAX_VERSION_CONFLICTS = 16;
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final Database database;
    private final String storeName;
    private final String namespace;
    private final Clock clock;

    public SqliteRecordStore(Database database, String storeName, Clock clock) {
        this.database = database;
        this.storeName = storeName;
        this.namespace = database.namespace();
        this.clock = clock;
    }

    @Override
    public String name() {
        return storeName;
    }

    @Override
    public Optional<StoredValue> get(String key) {
        try (Connection c = database.openConnection()) {
            return read(c, key);
        } catch (SQLException e) {
            throw translate("get", key, e);
        }
    }

    @Override
    public Optional<StoredValue> update(String key, UnaryOperator<String> transform) {
        try (Connection c = database.openConnection();
             PreparedStatement insert = c.prepareStatement(
                     "INSERT OR IGNORE INTO records(namespace,store_name,record_key,record_value,version,created_at_ms,updated_at_ms) VALUES(?,?,?,?,1,?,?)");
             PreparedStatement update = c.prepareStatement(
                     "UPDATE records SET record_value=?,version=version+1,updated_at_ms=? WHERE namespace=? AND store_name=? AND record_key=? AND version=?")) {
            for (int conflicts = 0; conflicts < MAX_VERSION_CONFLICTS; conflicts++) {
                Optional<StoredValue> current = read(c, key);
                String next = transform.apply(current.map(StoredValue::value).orElse(null));
                if (next == null) {
                    return current;
                }
                long nowMs = clock.millis();
                int rows;
                if (current.isEmpty()) {
                    insert.clearParameters();
                    insert.setString(1, namespace);
                    insert.setString(2, storeName);
                    insert.setString(3, key);
                    insert.setString(4, next);
                    insert.setLong(5, nowMs);
                    insert.setLong(6, nowMs);
                    rows = insert.executeUpdate();
                } else {
                    update.clearParameters();
                    update.setString(1, next);
                    update.setLong(2, nowMs);
                    update.setString(3, namespace);
                    update.setString(4, storeName);
                    update.setString(5, key);
                    update.setLong(6, current.get().version());
                    rows = update.executeUpdate();
                }
                if (rows == 1) {
                    long version = current.map(v -> v.version() + 1L).orElse(1L);
                    return Optional.of(new StoredValue(key, next, version, nowMs));
                }
            }
        } catch (SQLException e) {
            throw translate("update", key, e);
        }
        throw new TransientStoreException(
                TransientStoreException.Reason.CONTENTION,
                "Too many concurrent writers for " + storeName + "/" + key
        );
    }

    @Override
    public void remove(String key) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "DELETE FROM records WHERE namespace=? AND store_name=? AND record_key=?")) {
            ps.setString(1, namespace);
            ps.setString(2, storeName);
            ps.setString(3, key);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw translate("remove", key, e);
        }
    }

    private Optional<StoredValue> read(Connection c, String key) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT record_value,version,updated_at_ms FROM records WHERE namespace=? AND store_name=? AND record_key=?")) {
            ps.setString(1, namespace);
            ps.setString(2, storeName);
            ps.setString(3, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new StoredValue(
                        key,
                        rs.getString("record_value"),
                        rs.getLong("version"),
                        rs.getLong("updated_at_ms")
                ));
            }
        }
    }

    private RuntimeException translate(String op, String key, SQLException e) {
        int code = e.getErrorCode();
        if (code == SQLITE_BUSY || code == SQLITE_LOCKED) {
            return new TransientStoreException(
                    TransientStoreException.Reason.TIMEOUT,
                    "SQLite busy during " + op + " " + storeName + "/" + key,
                    e
            );
        }
        return new StoreUnavailableException("Failed to " + op + " " + storeName + "/" + key, e);
    }
}
