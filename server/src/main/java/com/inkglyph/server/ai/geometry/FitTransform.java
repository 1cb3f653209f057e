package com.inkglyph.server.ai.geometry;

import java.awt.geom.AffineTransform;

/**
 * Builds the transform that centers a stroke bounding box on the raster canvas
 * and normalizes its size.
 *
 * <p>
 * Only outliers are rescaled: when the longer side of the box is already inside
 * [minSize, maxSize] the scale is exactly 1.0 and the writer's natural size is
 * kept. Smaller input is scaled up to minSize, larger input down to maxSize.
 *
 * <p>
 * Point mapping is {@code p -> (p - boxCenter) * scale + canvasCenter}, so the
 * box center always lands on the canvas center whatever the scale.
 */
public class FitTransform {

    private final double canvasSize;
    private final double minSize;
    private final double maxSize;

    public FitTransform(double canvasSize, double minSize, double maxSize) {
        if (minSize > maxSize) {
            throw new IllegalArgumentException("minSize " + minSize + " > maxSize " + maxSize);
        }
        this.canvasSize = canvasSize;
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    public double targetSize(double rawSize) {
        if (rawSize < minSize) {
            return minSize;
        }
        if (rawSize > maxSize) {
            return maxSize;
        }
        return rawSize;
    }

    public double scaleFactor(BoundingBox box) {
        double rawSize = box.longerSide();
        // Single point or degenerate box: no scaling.
        if (!(rawSize > 0.0)) {
            return 1.0;
        }
        return targetSize(rawSize) / rawSize;
    }

    /**
     * @param box must be present; callers check for an empty session first
     */
    public AffineTransform compute(BoundingBox box) {
        double scale = scaleFactor(box);
        double center = canvasSize / 2.0;

        // AffineTransform concatenates right to left: the last call is applied
        // to the point first.
        AffineTransform transform = new AffineTransform();
        transform.translate(center, center);
        transform.scale(scale, scale);
        transform.translate(-box.centerX(), -box.centerY());
        return transform;
    }

    public double getCanvasSize() {
        return canvasSize;
    }
}
