package com.inkglyph.server.ai.inference;

import com.inkglyph.db.ScoreCacheDao;
import com.inkglyph.db.SqliteInitializer;
import com.inkglyph.server.ai.InitializationException;
import com.inkglyph.server.ai.encode.InputTensor;
import com.inkglyph.util.FloatArrayCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Serves raw scores for an already seen tensor from the SQLite cache instead of
 * running the model again. Cache errors are logged and treated as misses.
 */
public class CachingInferenceEngine implements InferenceEngine {

    private static final Logger logger = LoggerFactory.getLogger(CachingInferenceEngine.class);

    private final InferenceEngine delegate;
    private final ScoreCacheDao dao;

    public CachingInferenceEngine(InferenceEngine delegate, String dbPath) {
        this.delegate = delegate;
        try {
            SqliteInitializer.initialize(dbPath);
            logger.info("Initialized SQLite score cache at {}", dbPath);
        } catch (SQLException e) {
            delegate.close();
            throw new InitializationException("Failed to initialize score cache at " + dbPath, e);
        }
        this.dao = new ScoreCacheDao(dbPath);
        try {
            int purged = dao.deleteOtherVersions(delegate.getModelVersion());
            if (purged > 0) {
                logger.info("Purged {} cached score vectors of other model versions", purged);
            }
        } catch (SQLException e) {
            logger.warn("Failed to purge stale score cache entries", e);
        }
    }

    @Override
    public float[] infer(InputTensor tensor) {
        String hash = FloatArrayCodec.sha256Hex(tensor.data());
        String version = delegate.getModelVersion();

        try {
            Optional<float[]> cached = dao.loadScores(hash, version);
            if (cached.isPresent()) {
                logger.debug("Score cache hit for {}", hash);
                return cached.get();
            }
        } catch (SQLException e) {
            logger.warn("Score cache lookup failed, running model", e);
        }

        float[] scores = delegate.infer(tensor);
        try {
            dao.upsertScores(hash, version, scores);
        } catch (SQLException e) {
            logger.warn("Failed to store scores in cache", e);
        }
        return scores;
    }

    @Override
    public String getModelVersion() {
        return delegate.getModelVersion();
    }

    @Override
    public void close() {
        delegate.close();
    }

    ScoreCacheDao getDao() {
        return dao;
    }
}
