package com.inkglyph.server.ai;

/**
 * A label or model asset is missing or malformed. The recognizer stays
 * uninitialized until a later initialization succeeds.
 */
public class InitializationException extends RecognitionException {

    public InitializationException(String message) {
        super(message);
    }

    public InitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
