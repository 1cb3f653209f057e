package com.inkglyph.server.ai.inference;

import com.inkglyph.server.config.RecognizerConfig;
import com.inkglyph.server.config.RecognizerSettings;
import com.inkglyph.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public class InferenceEngineFactory {

    private static final Logger logger = LoggerFactory.getLogger(InferenceEngineFactory.class);

    public static InferenceEngine create(RecognizerSettings settings, RecognizerConfig.ConfigRoot config) {
        String engine = settings.engine;

        // ONNX is the only runtime; anything else falls back to it
        if (engine == null || engine.trim().isEmpty()) {
            logger.warn("Inference engine not specified, defaulting to 'onnx'");
        } else if (!"onnx".equalsIgnoreCase(engine.trim())) {
            logger.warn("Unknown inference engine '{}', defaulting to 'onnx'", engine);
        }

        InferenceEngine base = openOnnx(settings, config);
        if (settings.cacheEnabled) {
            return new CachingInferenceEngine(base, DataPathResolver.resolve(config, settings.cacheDbFile));
        }
        return base;
    }

    private static InferenceEngine openOnnx(RecognizerSettings settings, RecognizerConfig.ConfigRoot config) {
        Path modelPath = Path.of(DataPathResolver.resolve(config, settings.modelFile));
        return OnnxInferenceEngine.open(modelPath, settings.executionProvider, settings.modelVersion);
    }
}
