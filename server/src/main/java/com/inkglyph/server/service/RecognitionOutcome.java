package com.inkglyph.server.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.inkglyph.server.ai.ranking.RecognitionResult;
import com.inkglyph.server.ai.render.RasterBuffer;

import java.util.List;

public class RecognitionOutcome {

    public enum Status {
        OK,
        // Session had no points; nothing was sent to the model.
        EMPTY
    }

    private final long sequence;
    private final long sessionRevision;
    private final Status status;
    private final List<RecognitionResult> results;
    private final RasterBuffer raster;

    public RecognitionOutcome(long sequence, long sessionRevision, Status status, List<RecognitionResult> results,
            RasterBuffer raster) {
        this.sequence = sequence;
        this.sessionRevision = sessionRevision;
        this.status = status;
        this.results = results;
        this.raster = raster;
    }

    public static RecognitionOutcome empty(long sequence, long sessionRevision) {
        return new RecognitionOutcome(sequence, sessionRevision, Status.EMPTY, List.of(), null);
    }

    public long getSequence() {
        return sequence;
    }

    public long getSessionRevision() {
        return sessionRevision;
    }

    public Status getStatus() {
        return status;
    }

    public List<RecognitionResult> getResults() {
        return results;
    }

    @JsonIgnore
    public RasterBuffer getRaster() {
        return raster;
    }
}
