package com.inkglyph.server.ink;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Holds the strokes of one input session: the finalized strokes in drawing
 * order plus at most one active stroke.
 *
 * <p>
 * Event order is begin, extend*, end. Out-of-order events are tolerated:
 * {@code extendStroke} and {@code endStroke} without an active stroke are
 * no-ops, and a second {@code beginStroke} discards the unfinished stroke.
 */
public class StrokeSession {

    private final List<Stroke> strokes = new ArrayList<>();
    private List<Point> activeStroke;
    private long revision;

    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    public void beginStroke(Point p) {
        long changed;
        synchronized (this) {
            activeStroke = new ArrayList<>();
            activeStroke.add(p);
            changed = ++revision;
        }
        notifyListeners(changed);
    }

    public void extendStroke(Point p) {
        long changed;
        synchronized (this) {
            if (activeStroke == null) {
                return;
            }
            activeStroke.add(p);
            changed = ++revision;
        }
        notifyListeners(changed);
    }

    public void endStroke() {
        long changed;
        synchronized (this) {
            if (activeStroke == null) {
                return;
            }
            if (!activeStroke.isEmpty()) {
                strokes.add(new Stroke(activeStroke));
            }
            activeStroke = null;
            changed = ++revision;
        }
        notifyListeners(changed);
    }

    public void clear() {
        long changed;
        synchronized (this) {
            strokes.clear();
            activeStroke = null;
            changed = ++revision;
        }
        notifyListeners(changed);
    }

    public synchronized boolean isEmpty() {
        return strokes.isEmpty() && (activeStroke == null || activeStroke.isEmpty());
    }

    public synchronized int strokeCount() {
        return strokes.size();
    }

    public synchronized SessionSnapshot snapshot() {
        Stroke active = (activeStroke != null) ? new Stroke(activeStroke) : null;
        return new SessionSnapshot(revision, strokes, active);
    }

    public synchronized long getRevision() {
        return revision;
    }

    private void notifyListeners(long changed) {
        for (SessionListener listener : listeners) {
            listener.onSessionChanged(this, changed);
        }
    }
}
