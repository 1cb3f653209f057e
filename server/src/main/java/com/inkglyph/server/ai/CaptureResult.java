package com.inkglyph.server.ai;

import com.inkglyph.server.ai.geometry.BoundingBox;
import com.inkglyph.server.ai.render.RasterBuffer;

/**
 * Outcome of the capture step. An empty capture is the normal "nothing to
 * recognize" answer for a session without points, not an error.
 */
public class CaptureResult {

    private static final CaptureResult EMPTY = new CaptureResult(null, null, 0.0);

    private final RasterBuffer raster;
    private final BoundingBox bounds;
    private final double scale;

    public CaptureResult(RasterBuffer raster, BoundingBox bounds, double scale) {
        this.raster = raster;
        this.bounds = bounds;
        this.scale = scale;
    }

    public static CaptureResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return raster == null;
    }

    public RasterBuffer getRaster() {
        return raster;
    }

    public BoundingBox getBounds() {
        return bounds;
    }

    public double getScale() {
        return scale;
    }
}
