package com.inkglyph.server.ai.inference;

import com.inkglyph.server.ai.encode.InputTensor;

/**
 * Black-box character model: a [1, M, M, 1] tensor in, one raw score per class
 * out, aligned with the label file.
 */
public interface InferenceEngine extends AutoCloseable {

    /**
     * Runs the model. Runtime failures are reported as
     * {@link InferenceException} with the original cause attached.
     */
    float[] infer(InputTensor tensor);

    /**
     * Identifies the loaded model; cached scores are only reused for the same
     * version.
     */
    String getModelVersion();

    @Override
    default void close() {
    }
}
