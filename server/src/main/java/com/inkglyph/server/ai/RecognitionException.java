package com.inkglyph.server.ai;

/**
 * Base type of every failure raised by the recognition pipeline.
 */
public class RecognitionException extends RuntimeException {

    public RecognitionException(String message) {
        super(message);
    }

    public RecognitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
