package com.inkglyph.server.ink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One pen-down to pen-up point sequence. Instances are immutable; the active
 * stroke of a session is kept as a mutable list inside {@link StrokeSession}.
 */
public final class Stroke {
    private final List<Point> points;

    public Stroke(List<Point> points) {
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    public List<Point> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }
}
