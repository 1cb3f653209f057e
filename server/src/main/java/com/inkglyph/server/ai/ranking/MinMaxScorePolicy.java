package com.inkglyph.server.ai.ranking;

/**
 * Rescales the filtered scores linearly so the best in-alphabet candidate gets
 * 1.0 and the worst 0.0. Confidence is relative to the target alphabet, not to
 * the full vocabulary whose out-of-alphabet classes dominate absolute scores.
 *
 * <p>
 * When every filtered score is equal there is no spread and all confidences are
 * 0.0.
 *
 * <p>
 * Non-finite scores are left out of the min/max range. {@code +Infinity} maps
 * to 1.0, {@code NaN} and {@code -Infinity} map to 0.0.
 */
public class MinMaxScorePolicy implements ScorePolicy {

    @Override
    public double[] confidences(float[] rawScores) {
        double[] out = new double[rawScores.length];
        if (rawScores.length == 0) {
            return out;
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (float s : rawScores) {
            if (!Float.isFinite(s)) {
                continue;
            }
            if (s < min)
                min = s;
            if (s > max)
                max = s;
        }

        double range = max - min;
        for (int i = 0; i < rawScores.length; i++) {
            float s = rawScores[i];
            if (s == Float.POSITIVE_INFINITY) {
                out[i] = 1.0;
            } else if (!Float.isFinite(s) || !(range > 0.0)) {
                out[i] = 0.0;
            } else {
                out[i] = (s - min) / range;
            }
        }
        return out;
    }
}
