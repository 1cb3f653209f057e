package com.inkglyph.server.ai.geometry;

import com.inkglyph.server.ink.Point;
import com.inkglyph.server.ink.SessionSnapshot;
import com.inkglyph.server.ink.Stroke;

import java.util.Optional;

/**
 * Computes the padded bounding box of every point in a session, finalized and
 * active strokes alike.
 */
public class BoundsCalculator {

    private final double padding;
    private final double canvasSize;

    /**
     * @param padding    margin added on each side, normally half the render
     *                   stroke width so round caps at the extremes survive
     * @param canvasSize padding never extends the box past [0, canvasSize]
     */
    public BoundsCalculator(double padding, double canvasSize) {
        if (padding < 0) {
            throw new IllegalArgumentException("padding must be >= 0");
        }
        this.padding = padding;
        this.canvasSize = canvasSize;
    }

    public Optional<BoundingBox> compute(SessionSnapshot snapshot) {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        boolean any = false;

        for (Stroke stroke : snapshot.allStrokes()) {
            for (Point p : stroke.getPoints()) {
                minX = Math.min(minX, p.getX());
                minY = Math.min(minY, p.getY());
                maxX = Math.max(maxX, p.getX());
                maxY = Math.max(maxY, p.getY());
                any = true;
            }
        }

        if (!any) {
            return Optional.empty();
        }

        return Optional.of(new BoundingBox(
                padLower(minX),
                padLower(minY),
                padUpper(maxX),
                padUpper(maxY)));
    }

    // Padding stops at the canvas edge; raw points outside the canvas stay inside
    // the box.
    private double padLower(double rawMin) {
        return Math.min(rawMin, Math.max(rawMin - padding, 0.0));
    }

    private double padUpper(double rawMax) {
        return Math.max(rawMax, Math.min(rawMax + padding, canvasSize));
    }

    public double getPadding() {
        return padding;
    }
}
