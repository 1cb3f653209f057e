package com.inkglyph.server.ai.ranking;

public class RecognitionResult {
    private final String glyph;
    private final double confidence;

    public RecognitionResult(String glyph, double confidence) {
        this.glyph = glyph;
        this.confidence = confidence;
    }

    public String getGlyph() {
        return glyph;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return glyph + "=" + String.format("%.4f", confidence);
    }
}
