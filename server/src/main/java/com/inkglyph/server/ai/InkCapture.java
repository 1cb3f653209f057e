package com.inkglyph.server.ai;

import com.inkglyph.server.ai.geometry.BoundingBox;
import com.inkglyph.server.ai.geometry.BoundsCalculator;
import com.inkglyph.server.ai.geometry.FitTransform;
import com.inkglyph.server.ai.render.RasterBuffer;
import com.inkglyph.server.ai.render.StrokeRasterizer;
import com.inkglyph.server.ink.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.AffineTransform;
import java.util.Optional;

/**
 * Bounds, fit and rasterize: turns a session snapshot into the fixed-size
 * canvas the encoder expects. Pure with respect to the snapshot.
 */
public class InkCapture {

    private static final Logger logger = LoggerFactory.getLogger(InkCapture.class);

    private final BoundsCalculator boundsCalculator;
    private final FitTransform fitTransform;
    private final StrokeRasterizer rasterizer;

    public InkCapture(BoundsCalculator boundsCalculator, FitTransform fitTransform, StrokeRasterizer rasterizer) {
        this.boundsCalculator = boundsCalculator;
        this.fitTransform = fitTransform;
        this.rasterizer = rasterizer;
    }

    public CaptureResult capture(SessionSnapshot snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            return CaptureResult.empty();
        }
        Optional<BoundingBox> bounds = boundsCalculator.compute(snapshot);
        if (bounds.isEmpty()) {
            return CaptureResult.empty();
        }

        BoundingBox box = bounds.get();
        double scale = fitTransform.scaleFactor(box);
        AffineTransform transform = fitTransform.compute(box);
        RasterBuffer raster = rasterizer.render(snapshot, transform);

        logger.debug("Captured revision {}: {} strokes, {} points, {}, scale={}", snapshot.getRevision(),
                snapshot.allStrokes().size(), snapshot.pointCount(), box, String.format("%.4f", scale));
        return new CaptureResult(raster, box, scale);
    }
}
