package com.slicebot.db;

import com.slicebot.model.CachedRecord;
import com.slicebot.model.QueryMode;
import com.slicebot.storage.CachedRecordStore;
import org.json.JSONArray;

import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：CachedRecordDao（class）。
 * 主要职责：以 PostgreSQL 持久化每个参数的缓存记录集合；日度数组以 JSON 文本存储。
 * 使用建议：replace 在单个事务内删除并重写该参数的全部记录，调用方无需关心部分写入。
 */
public final class CachedRecordDao implements CachedRecordStore {
    private final Database database;

    public CachedRecordDao(Database database) {
        this.database = database;
    }

    @Override
    public List<CachedRecord> load(String objectId) {
        try {
            return loadRecords(objectId);
        } catch (SQLException e) {
            throw new IllegalStateException("cached_records load failed object=" + objectId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void replace(String objectId, List<CachedRecord> records) {
        try {
            replaceRecords(objectId, records);
        } catch (SQLException e) {
            throw new IllegalStateException("cached_records replace failed object=" + objectId + ": " + e.getMessage(), e);
        }
    }

    public List<CachedRecord> loadRecords(String objectId) throws SQLException {
        String sql = "SELECT mode, slice_dsl, query_signature, window_from, window_to, n, k, " +
                "dates_json, n_daily_json, k_daily_json, retrieved_at " +
                "FROM cached_records WHERE object_id = ? ORDER BY seq";
        List<CachedRecord> out = new ArrayList<>();
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, objectId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Date from = rs.getDate("window_from");
                    Date to = rs.getDate("window_to");
                    Timestamp retrieved = rs.getTimestamp("retrieved_at");
                    out.add(CachedRecord.builder()
                            .mode(QueryMode.fromLabel(rs.getString("mode")))
                            .sliceDsl(rs.getString("slice_dsl"))
                            .querySignature(rs.getString("query_signature"))
                            .windowFrom(from == null ? null : from.toLocalDate())
                            .windowTo(to == null ? null : to.toLocalDate())
                            .n(rs.getLong("n"))
                            .k(rs.getLong("k"))
                            .dates(parseDates(rs.getString("dates_json")))
                            .nDaily(parseLongs(rs.getString("n_daily_json")))
                            .kDaily(parseLongs(rs.getString("k_daily_json")))
                            .retrievedAt(retrieved == null ? null : retrieved.toInstant())
                            .build());
                }
            }
        }
        return out;
    }

    public void replaceRecords(String objectId, List<CachedRecord> records) throws SQLException {
        String delete = "DELETE FROM cached_records WHERE object_id = ?";
        String insert = "INSERT INTO cached_records(object_id, seq, mode, slice_dsl, query_signature, window_from, " +
                "window_to, n, k, dates_json, n_daily_json, k_daily_json, retrieved_at) " +
                "VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = database.connect()) {
            boolean oldAutoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement del = conn.prepareStatement(delete);
                 PreparedStatement ins = conn.prepareStatement(insert)) {
                del.setString(1, objectId);
                del.executeUpdate();
                int seq = 0;
                for (CachedRecord r : records == null ? List.<CachedRecord>of() : records) {
                    ins.setString(1, objectId);
                    ins.setInt(2, seq++);
                    ins.setString(3, r.modeOrDefault().label());
                    ins.setString(4, r.sliceDsl == null ? "" : r.sliceDsl);
                    ins.setString(5, r.signatureOrBlank());
                    ins.setDate(6, r.windowFrom == null ? null : Date.valueOf(r.windowFrom));
                    ins.setDate(7, r.windowTo == null ? null : Date.valueOf(r.windowTo));
                    ins.setLong(8, r.n);
                    ins.setLong(9, r.k);
                    ins.setString(10, datesJson(r.dates));
                    ins.setString(11, longsJson(r.nDaily));
                    ins.setString(12, longsJson(r.kDaily));
                    ins.setTimestamp(13, r.retrievedAt == null ? null : Timestamp.from(r.retrievedAt));
                    ins.addBatch();
                }
                ins.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(oldAutoCommit);
            }
        }
    }

    static String datesJson(List<LocalDate> dates) {
        JSONArray arr = new JSONArray();
        if (dates != null) {
            for (LocalDate d : dates) {
                arr.put(d == null ? "" : d.toString());
            }
        }
        return arr.toString();
    }

    static String longsJson(List<Long> values) {
        JSONArray arr = new JSONArray();
        if (values != null) {
            for (Long v : values) {
                arr.put(v == null ? -1L : v);
            }
        }
        return arr.toString();
    }

    static List<LocalDate> parseDates(String json) {
        List<LocalDate> out = new ArrayList<>();
        if (json == null || json.trim().isEmpty()) {
            return out;
        }
        JSONArray arr = new JSONArray(json);
        for (int i = 0; i < arr.length(); i++) {
            String raw = arr.optString(i, "");
            out.add(raw.isEmpty() ? null : LocalDate.parse(raw));
        }
        return out;
    }

    static List<Long> parseLongs(String json) {
        List<Long> out = new ArrayList<>();
        if (json == null || json.trim().isEmpty()) {
            return out;
        }
        JSONArray arr = new JSONArray(json);
        for (int i = 0; i < arr.length(); i++) {
            long v = arr.optLong(i, -1L);
            out.add(v < 0L ? null : v);
        }
        return out;
    }
}
