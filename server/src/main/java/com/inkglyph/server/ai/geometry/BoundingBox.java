package com.inkglyph.server.ai.geometry;

/**
 * Axis-aligned box in capture-surface coordinates. minX <= maxX and
 * minY <= maxY always hold.
 */
public final class BoundingBox {
    private final double minX;
    private final double minY;
    private final double maxX;
    private final double maxY;

    public BoundingBox(double minX, double minY, double maxX, double maxY) {
        if (minX > maxX || minY > maxY) {
            throw new IllegalArgumentException(
                    "Inverted box: (" + minX + ", " + minY + ") - (" + maxX + ", " + maxY + ")");
        }
        this.minX = minX;
        this.minY = minY;
        this.maxX = maxX;
        this.maxY = maxY;
    }

    public double getMinX() {
        return minX;
    }

    public double getMinY() {
        return minY;
    }

    public double getMaxX() {
        return maxX;
    }

    public double getMaxY() {
        return maxY;
    }

    public double width() {
        return maxX - minX;
    }

    public double height() {
        return maxY - minY;
    }

    public double centerX() {
        return (minX + maxX) / 2.0;
    }

    public double centerY() {
        return (minY + maxY) / 2.0;
    }

    /**
     * The larger of width and height.
     */
    public double longerSide() {
        return Math.max(width(), height());
    }

    public boolean contains(double x, double y, double epsilon) {
        return x >= minX - epsilon && x <= maxX + epsilon && y >= minY - epsilon && y <= maxY + epsilon;
    }

    @Override
    public String toString() {
        return String.format("BoundingBox[(%.2f, %.2f) - (%.2f, %.2f)]", minX, minY, maxX, maxY);
    }
}
