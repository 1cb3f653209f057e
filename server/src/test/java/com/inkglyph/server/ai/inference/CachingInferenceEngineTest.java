package com.inkglyph.server.ai.inference;

import com.inkglyph.server.ai.InitializationException;
import com.inkglyph.server.ai.encode.InputTensor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class CachingInferenceEngineTest {

    private static InputTensor tensor(float fill) {
        float[] data = new float[4 * 4];
        Arrays.fill(data, fill);
        return new InputTensor(4, data);
    }

    @Test
    public void testSecondIdenticalTensorIsServedFromCache(@TempDir Path dir) throws Exception {
        FixedScoreEngine delegate = new FixedScoreEngine(0.1f, 0.7f, 0.2f);
        CachingInferenceEngine engine = new CachingInferenceEngine(delegate, dir.resolve("cache.db").toString());

        float[] first = engine.infer(tensor(0.5f));
        float[] second = engine.infer(tensor(0.5f));

        assertEquals(1, delegate.getCalls());
        assertArrayEquals(first, second, 0.0f);

        engine.infer(tensor(0.25f));
        assertEquals(2, delegate.getCalls(), "Different tensor must run the model");
    }

    @Test
    public void testModelVersionChangeInvalidatesEntries(@TempDir Path dir) {
        String db = dir.resolve("cache.db").toString();

        FixedScoreEngine v1 = new FixedScoreEngine("v1", 1f, 2f);
        new CachingInferenceEngine(v1, db).infer(tensor(0.5f));

        FixedScoreEngine v2 = new FixedScoreEngine("v2", 3f, 4f);
        CachingInferenceEngine cached = new CachingInferenceEngine(v2, db);
        float[] scores = cached.infer(tensor(0.5f));

        assertEquals(1, v2.getCalls());
        assertArrayEquals(new float[] { 3f, 4f }, scores, 0.0f);
    }

    @Test
    public void testCloseReachesDelegate(@TempDir Path dir) {
        FixedScoreEngine delegate = new FixedScoreEngine(1f);
        CachingInferenceEngine engine = new CachingInferenceEngine(delegate, dir.resolve("cache.db").toString());
        assertEquals("fixed-v1", engine.getModelVersion());
        engine.close();
        assertTrue(delegate.isClosed());
    }

    @Test
    public void testCacheSetupFailureClosesDelegate(@TempDir Path dir) {
        FixedScoreEngine delegate = new FixedScoreEngine(1f);
        String unreachable = dir.resolve("no-such-dir").resolve("cache.db").toString();

        assertThrows(InitializationException.class, () -> new CachingInferenceEngine(delegate, unreachable));
        assertTrue(delegate.isClosed());
    }
}
