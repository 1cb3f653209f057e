package com.inkglyph.server.ai.ranking;

/**
 * Maps raw scores of the filtered candidates to confidences in [0, 1].
 */
public interface ScorePolicy {

    /**
     * @param rawScores raw model scores of the filtered candidates only, in
     *                  candidate order
     * @return one confidence per input entry, same order
     */
    double[] confidences(float[] rawScores);
}
