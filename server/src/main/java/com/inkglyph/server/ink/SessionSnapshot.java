package com.inkglyph.server.ink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable view of a {@link StrokeSession} at one revision. This is what the
 * capture pipeline consumes, so rendering never touches live session state.
 */
public final class SessionSnapshot {

    private static final SessionSnapshot EMPTY = new SessionSnapshot(0L, List.of(), null);

    private final long revision;
    private final List<Stroke> strokes;
    // null when no stroke is in progress
    private final Stroke activeStroke;

    public SessionSnapshot(long revision, List<Stroke> strokes, Stroke activeStroke) {
        this.revision = revision;
        this.strokes = Collections.unmodifiableList(new ArrayList<>(strokes));
        this.activeStroke = activeStroke;
    }

    public static SessionSnapshot empty() {
        return EMPTY;
    }

    /**
     * Builds a snapshot of finalized strokes only, e.g. from a stateless
     * request body.
     */
    public static SessionSnapshot of(List<List<Point>> strokes) {
        List<Stroke> finalized = new ArrayList<>();
        for (List<Point> points : strokes) {
            if (points != null && !points.isEmpty()) {
                finalized.add(new Stroke(points));
            }
        }
        return new SessionSnapshot(0L, finalized, null);
    }

    public long getRevision() {
        return revision;
    }

    public List<Stroke> getStrokes() {
        return strokes;
    }

    public Stroke getActiveStroke() {
        return activeStroke;
    }

    public boolean hasActiveStroke() {
        return activeStroke != null && !activeStroke.isEmpty();
    }

    /**
     * Finalized strokes followed by the active stroke, when there is one.
     */
    public List<Stroke> allStrokes() {
        if (!hasActiveStroke()) {
            return strokes;
        }
        List<Stroke> all = new ArrayList<>(strokes.size() + 1);
        all.addAll(strokes);
        all.add(activeStroke);
        return all;
    }

    public int pointCount() {
        int count = 0;
        for (Stroke s : allStrokes()) {
            count += s.size();
        }
        return count;
    }

    public boolean isEmpty() {
        return strokes.isEmpty() && !hasActiveStroke();
    }
}
