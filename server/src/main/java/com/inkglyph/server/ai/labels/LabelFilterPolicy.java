package com.inkglyph.server.ai.labels;

public interface LabelFilterPolicy {

    /**
     * Whether a class whose label starts with this code point belongs to the
     * target alphabet.
     */
    boolean accepts(int codePoint);
}
