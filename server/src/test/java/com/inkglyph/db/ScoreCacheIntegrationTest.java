package com.inkglyph.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.sql.SQLException;
import java.util.Optional;

public class ScoreCacheIntegrationTest {

    private static final String TEST_DB = "test_score_cache.db";
    private ScoreCacheDao dao;

    @BeforeEach
    public void setup() throws SQLException {
        deleteDbFiles();
        SqliteInitializer.initialize(TEST_DB);
        dao = new ScoreCacheDao(TEST_DB);
    }

    @AfterEach
    public void teardown() {
        deleteDbFiles();
    }

    private static void deleteDbFiles() {
        for (String suffix : new String[] { "", "-wal", "-shm" }) {
            File f = new File(TEST_DB + suffix);
            if (f.exists()) {
                f.delete();
            }
        }
    }

    @Test
    public void testScoreCacheCrud() throws SQLException {
        float[] scores = { 0.1f, 0.2f, 0.3f };
        Assertions.assertFalse(dao.loadScores("h1", "v1").isPresent());

        dao.upsertScores("h1", "v1", scores);
        Optional<float[]> loaded = dao.loadScores("h1", "v1");
        Assertions.assertTrue(loaded.isPresent());
        Assertions.assertArrayEquals(scores, loaded.get(), 0.0f);
        Assertions.assertEquals(1, dao.hitCount("h1", "v1"));

        // Update keeps one row per key
        float[] scores2 = { 0.9f, 0.8f };
        dao.upsertScores("h1", "v1", scores2);
        Assertions.assertArrayEquals(scores2, dao.loadScores("h1", "v1").get(), 0.0f);
        Assertions.assertEquals(2, dao.hitCount("h1", "v1"));

        Assertions.assertFalse(dao.loadScores("h1", "v2").isPresent());
    }

    @Test
    public void testDeleteOtherVersions() throws SQLException {
        dao.upsertScores("h1", "v1", new float[] { 1f });
        dao.upsertScores("h2", "v1", new float[] { 2f });
        dao.upsertScores("h1", "v2", new float[] { 3f });

        Assertions.assertEquals(2, dao.deleteOtherVersions("v2"));
        Assertions.assertFalse(dao.loadScores("h1", "v1").isPresent());
        Assertions.assertTrue(dao.loadScores("h1", "v2").isPresent());
    }
}
