package com.inkglyph.db;

import com.inkglyph.util.FloatArrayCodec;

import java.sql.*;
import java.util.Optional;

public class ScoreCacheDao {

    private final String dbPath;

    public ScoreCacheDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public Optional<float[]> loadScores(String tensorHash, String modelVersion) throws SQLException {
        String sql = "SELECT id, scores_blob FROM score_cache WHERE tensor_hash = ? AND model_version = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, tensorHash);
            ps.setString(2, modelVersion);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    long id = rs.getLong("id");
                    byte[] blob = rs.getBytes("scores_blob");
                    try (PreparedStatement hit = conn.prepareStatement(
                            "UPDATE score_cache SET hit_count = hit_count + 1 WHERE id = ?")) {
                        hit.setLong(1, id);
                        hit.executeUpdate();
                    }
                    return Optional.ofNullable(FloatArrayCodec.fromBytes(blob));
                }
            }
        }
        return Optional.empty();
    }

    public void upsertScores(String tensorHash, String modelVersion, float[] scores) throws SQLException {
        byte[] blob = FloatArrayCodec.toBytes(scores);
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO score_cache (tensor_hash, model_version, scores_blob, created_ts) " +
                "VALUES (?, ?, ?, ?) " +
                "ON CONFLICT(tensor_hash, model_version) DO UPDATE SET " +
                "scores_blob = excluded.scores_blob, created_ts = excluded.created_ts";

        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, tensorHash);
            ps.setString(2, modelVersion);
            ps.setBytes(3, blob);
            ps.setLong(4, now);
            ps.executeUpdate();
        }
    }

    public int hitCount(String tensorHash, String modelVersion) throws SQLException {
        String sql = "SELECT hit_count FROM score_cache WHERE tensor_hash = ? AND model_version = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, tensorHash);
            ps.setString(2, modelVersion);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt("hit_count") : 0;
            }
        }
    }

    // Entries of other model versions can never be hit again.
    public int deleteOtherVersions(String modelVersion) throws SQLException {
        String sql = "DELETE FROM score_cache WHERE model_version <> ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, modelVersion);
            return ps.executeUpdate();
        }
    }
}
