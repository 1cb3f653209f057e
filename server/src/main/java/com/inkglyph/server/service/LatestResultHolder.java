package com.inkglyph.server.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the outcome with the highest request sequence number. Recognitions may
 * complete out of order; a completion older than the one already held is
 * dropped.
 */
public class LatestResultHolder {

    private static final Logger logger = LoggerFactory.getLogger(LatestResultHolder.class);

    private final AtomicReference<RecognitionOutcome> latest = new AtomicReference<>();

    /**
     * @return true if the outcome was accepted as the newest one
     */
    public boolean offer(RecognitionOutcome outcome) {
        while (true) {
            RecognitionOutcome current = latest.get();
            if (current != null && current.getSequence() >= outcome.getSequence()) {
                logger.debug("Discarding stale outcome #{} (holding #{})", outcome.getSequence(),
                        current.getSequence());
                return false;
            }
            if (latest.compareAndSet(current, outcome)) {
                return true;
            }
        }
    }

    public RecognitionOutcome get() {
        return latest.get();
    }

    public void reset() {
        latest.set(null);
    }
}
