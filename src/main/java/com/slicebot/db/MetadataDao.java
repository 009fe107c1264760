package com.slicebot.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

public final class MetadataDao {
    private final Database database;

    public MetadataDao(Database database) {
        this.database = database;
    }

    public Optional<String> get(String key) throws SQLException {
        String sql = "SELECT meta_value FROM run_metadata WHERE meta_key = ?";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString(1));
                }
            }
        }
        return Optional.empty();
    }

    public void put(String key, String value) throws SQLException {
        String sql = "INSERT INTO run_metadata(meta_key, meta_value, updated_at) VALUES(?, ?, ?) " +
                "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.setObject(3, Timestamp.from(Instant.now()));
            ps.executeUpdate();
        }
    }

    /**
     * Insert only when the key is absent, or when the stored value's lease has expired.
     *
     * @return true if this call now owns the key
     */
    public boolean putIfAbsentOrExpired(String key, String value, Instant expiredBefore) throws SQLException {
        String sql = "INSERT INTO run_metadata(meta_key, meta_value, updated_at) VALUES(?, ?, ?) " +
                "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at " +
                "WHERE run_metadata.updated_at < ?";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.setObject(3, Timestamp.from(Instant.now()));
            ps.setObject(4, Timestamp.from(expiredBefore));
            return ps.executeUpdate() > 0;
        }
    }

    public boolean deleteIfValue(String key, String value) throws SQLException {
        String sql = "DELETE FROM run_metadata WHERE meta_key = ? AND meta_value = ?";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, value);
            return ps.executeUpdate() > 0;
        }
    }

    public void delete(String key) throws SQLException {
        String sql = "DELETE FROM run_metadata WHERE meta_key = ?";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.executeUpdate();
        }
    }
}
