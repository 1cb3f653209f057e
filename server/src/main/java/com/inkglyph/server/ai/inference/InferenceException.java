package com.inkglyph.server.ai.inference;

import com.inkglyph.server.ai.RecognitionException;

/**
 * Wraps a failure of the underlying inference runtime. The cause is kept as is;
 * nothing here retries.
 */
public class InferenceException extends RecognitionException {

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
