package com.inkglyph.server.ai.ranking;

import com.inkglyph.server.ai.InvalidInputException;
import com.inkglyph.server.ai.NotInitializedException;
import com.inkglyph.server.ai.labels.FilteredIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a raw score vector into the top-K in-alphabet guesses.
 */
public class ResultRanker {

    private static final Logger logger = LoggerFactory.getLogger(ResultRanker.class);

    private final ScorePolicy scorePolicy;
    private final int topK;

    public ResultRanker(ScorePolicy scorePolicy, int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
        this.scorePolicy = scorePolicy;
        this.topK = topK;
    }

    public List<RecognitionResult> rank(float[] rawScores, FilteredIndex index) {
        if (index == null) {
            throw new NotInitializedException("Label filter has not been built");
        }
        if (rawScores == null || rawScores.length != index.getTotalClassCount()) {
            throw new InvalidInputException("Expected " + index.getTotalClassCount() + " scores, got "
                    + (rawScores == null ? "null" : String.valueOf(rawScores.length)));
        }

        float[] filtered = new float[index.size()];
        for (int i = 0; i < filtered.length; i++) {
            filtered[i] = rawScores[index.classIndexAt(i)];
        }
        double[] confidences = scorePolicy.confidences(filtered);

        List<RecognitionResult> candidates = new ArrayList<>(filtered.length);
        for (int i = 0; i < filtered.length; i++) {
            candidates.add(new RecognitionResult(index.glyphAt(i), confidences[i]));
        }

        // List.sort is stable: equal confidences keep class index order.
        candidates.sort(Comparator.comparingDouble(RecognitionResult::getConfidence).reversed());

        List<RecognitionResult> top = new ArrayList<>(candidates.subList(0, Math.min(topK, candidates.size())));
        if (logger.isDebugEnabled()) {
            logger.debug("Ranked {} candidates, top: {}", candidates.size(), top);
        }
        return top;
    }

    public int getTopK() {
        return topK;
    }
}
