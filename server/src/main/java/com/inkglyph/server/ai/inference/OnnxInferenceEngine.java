package com.inkglyph.server.ai.inference;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.inkglyph.server.ai.InitializationException;
import com.inkglyph.server.ai.encode.InputTensor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

/**
 * Runs the character model with ONNX Runtime. The tensor is fed under the
 * model's first input name and the first output is read as a [1, N] (or [N])
 * float array.
 */
public class OnnxInferenceEngine implements InferenceEngine {

    private static final Logger logger = LoggerFactory.getLogger(OnnxInferenceEngine.class);

    private final OrtEnvironment env;
    private final OrtSession session;
    private final String inputName;
    private final String modelVersion;

    private OnnxInferenceEngine(OrtEnvironment env, OrtSession session, String inputName, String modelVersion) {
        this.env = env;
        this.session = session;
        this.inputName = inputName;
        this.modelVersion = modelVersion;
    }

    /**
     * @param executionProvider "cpu" (default) or "cuda"
     */
    public static OnnxInferenceEngine open(Path modelPath, String executionProvider, String modelVersion) {
        if (modelPath == null || !Files.isRegularFile(modelPath)) {
            throw new InitializationException("Model file not found: " + modelPath);
        }
        try {
            String version = (modelVersion != null && !modelVersion.isEmpty())
                    ? modelVersion
                    : modelPath.getFileName().toString() + "@" + Files.size(modelPath);
            OrtEnvironment env = OrtEnvironment.getEnvironment();
            OrtSession session;
            try (OrtSession.SessionOptions options = new OrtSession.SessionOptions()) {
                String provider = executionProvider == null ? "" : executionProvider.trim().toLowerCase();
                if ("cuda".equals(provider)) {
                    options.addCUDA();
                }
                session = env.createSession(modelPath.toString(), options);
            }
            if (session.getInputNames().isEmpty()) {
                session.close();
                throw new InitializationException("Model " + modelPath + " declares no inputs");
            }
            String inputName = session.getInputNames().iterator().next();
            logger.info("Loaded ONNX model {} (input '{}', version {})", modelPath.toAbsolutePath(), inputName,
                    version);
            return new OnnxInferenceEngine(env, session, inputName, version);
        } catch (OrtException e) {
            throw new InitializationException("Failed to load model " + modelPath, e);
        } catch (IOException e) {
            throw new InitializationException("Failed to stat model " + modelPath, e);
        }
    }

    @Override
    public float[] infer(InputTensor tensor) {
        try (OnnxTensor input = OnnxTensor.createTensor(env, FloatBuffer.wrap(tensor.data()), tensor.shape());
                OrtSession.Result result = session.run(Collections.singletonMap(inputName, input))) {
            OnnxValue output = result.get(0);
            Object value = output.getValue();
            if (value instanceof float[][]) {
                return ((float[][]) value)[0];
            }
            if (value instanceof float[]) {
                return (float[]) value;
            }
            throw new InferenceException("Unexpected model output type " + value.getClass().getName(), null);
        } catch (OrtException e) {
            throw new InferenceException("ONNX inference failed", e);
        }
    }

    @Override
    public String getModelVersion() {
        return modelVersion;
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (OrtException e) {
            logger.warn("Failed to close ONNX session", e);
        }
    }
}
