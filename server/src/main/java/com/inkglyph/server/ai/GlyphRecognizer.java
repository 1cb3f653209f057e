package com.inkglyph.server.ai;

import com.inkglyph.server.ai.encode.InputTensor;
import com.inkglyph.server.ai.encode.TensorEncoder;
import com.inkglyph.server.ai.inference.InferenceEngine;
import com.inkglyph.server.ai.inference.InferenceException;
import com.inkglyph.server.ai.labels.FilteredIndex;
import com.inkglyph.server.ai.labels.LabelFilter;
import com.inkglyph.server.ai.labels.LabelTable;
import com.inkglyph.server.ai.ranking.RecognitionResult;
import com.inkglyph.server.ai.ranking.ResultRanker;
import com.inkglyph.server.ai.render.RasterBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Encodes a captured raster, runs the inference engine and ranks the output
 * against the target alphabet.
 *
 * <p>
 * {@link #initialize} publishes the label index and engine together; until it
 * succeeds every recognition fails with {@link NotInitializedException}. After
 * that the recognizer is safe to share between worker threads.
 */
public class GlyphRecognizer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GlyphRecognizer.class);

    private static final class State {
        final FilteredIndex index;
        final InferenceEngine engine;

        State(FilteredIndex index, InferenceEngine engine) {
            this.index = index;
            this.engine = engine;
        }
    }

    private final TensorEncoder encoder;
    private final LabelFilter labelFilter;
    private final ResultRanker ranker;

    private volatile State state;

    public GlyphRecognizer(TensorEncoder encoder, LabelFilter labelFilter, ResultRanker ranker) {
        this.encoder = encoder;
        this.labelFilter = labelFilter;
        this.ranker = ranker;
    }

    /**
     * Builds the filtered label index and takes ownership of the engine. On
     * failure the engine is closed and any previous state is kept cleared.
     *
     * @throws InitializationException if the labels are empty or none match the
     *                                 target alphabet
     */
    public synchronized void initialize(LabelTable labels, InferenceEngine engine) {
        State previous = state;
        state = null;
        if (previous != null) {
            previous.engine.close();
        }

        FilteredIndex index;
        try {
            index = labelFilter.build(labels);
        } catch (InitializationException e) {
            engine.close();
            throw e;
        }
        state = new State(index, engine);
        logger.info("Recognizer ready: {} target glyphs out of {} classes, model {}", index.size(),
                index.getTotalClassCount(), engine.getModelVersion());
    }

    public boolean isInitialized() {
        return state != null;
    }

    public List<RecognitionResult> recognize(RasterBuffer raster) {
        State current = requireState();
        if (raster == null) {
            throw new InvalidInputException("Nothing to recognize: no raster");
        }
        return recognize(current, encoder.encode(raster));
    }

    public List<RecognitionResult> recognize(InputTensor tensor) {
        return recognize(requireState(), tensor);
    }

    private List<RecognitionResult> recognize(State current, InputTensor tensor) {
        float[] scores;
        try {
            scores = current.engine.infer(tensor);
        } catch (RecognitionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InferenceException("Inference engine failed", e);
        }
        return ranker.rank(scores, current.index);
    }

    private State requireState() {
        State current = state;
        if (current == null) {
            throw new NotInitializedException("Recognizer not initialized");
        }
        return current;
    }

    public FilteredIndex getFilteredIndex() {
        State current = state;
        return current != null ? current.index : null;
    }

    public TensorEncoder getEncoder() {
        return encoder;
    }

    @Override
    public synchronized void close() {
        State current = state;
        state = null;
        if (current != null) {
            current.engine.close();
        }
    }
}
