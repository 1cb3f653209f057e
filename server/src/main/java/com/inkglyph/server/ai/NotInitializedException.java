package com.inkglyph.server.ai;

public class NotInitializedException extends RecognitionException {

    public NotInitializedException(String message) {
        super(message);
    }
}
