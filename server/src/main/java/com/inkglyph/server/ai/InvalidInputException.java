package com.inkglyph.server.ai;

/**
 * Caller contract violation: wrong score vector length, zero-size raster or an
 * empty session handed directly to the recognizer.
 */
public class InvalidInputException extends RecognitionException {

    public InvalidInputException(String message) {
        super(message);
    }
}
