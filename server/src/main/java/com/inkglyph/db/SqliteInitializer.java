package com.inkglyph.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL;");

                // One raw score vector per (tensor content, model version)
                stmt.execute("CREATE TABLE IF NOT EXISTS score_cache (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "tensor_hash TEXT NOT NULL, " +
                        "model_version TEXT NOT NULL, " +
                        "scores_blob BLOB NOT NULL, " +
                        "hit_count INTEGER NOT NULL DEFAULT 0, " +
                        "created_ts INTEGER NOT NULL, " +
                        "UNIQUE (tensor_hash, model_version)" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_score_cache_version " +
                        "ON score_cache (model_version);");
            }
        }
    }
}
