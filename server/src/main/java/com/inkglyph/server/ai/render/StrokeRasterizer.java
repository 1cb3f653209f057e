package com.inkglyph.server.ai.render;

import com.inkglyph.server.ink.Point;
import com.inkglyph.server.ink.SessionSnapshot;
import com.inkglyph.server.ink.Stroke;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a session onto a square canvas. Each point is mapped through the fit
 * transform before path construction; the graphics context itself stays
 * untransformed so the pen width is the same for every input size.
 */
public class StrokeRasterizer {

    private final int canvasSize;
    private final RenderPolicy renderPolicy;

    public StrokeRasterizer(int canvasSize, RenderPolicy renderPolicy) {
        if (canvasSize <= 0) {
            throw new IllegalArgumentException("canvasSize must be positive");
        }
        this.canvasSize = canvasSize;
        this.renderPolicy = renderPolicy;
    }

    /**
     * Finalized strokes are drawn in order, then the active stroke if the
     * snapshot was taken mid-stroke.
     */
    public RasterBuffer render(SessionSnapshot snapshot, AffineTransform transform) {
        BufferedImage image = new BufferedImage(canvasSize, canvasSize, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL, RenderingHints.VALUE_STROKE_PURE);
            g.setColor(renderPolicy.background());
            g.fillRect(0, 0, canvasSize, canvasSize);

            for (Stroke stroke : snapshot.allStrokes()) {
                renderPolicy.paintStroke(g, transformPoints(stroke, transform));
            }
        } finally {
            g.dispose();
        }
        return RasterBuffer.fromImage(image);
    }

    static List<Point2D> transformPoints(Stroke stroke, AffineTransform transform) {
        List<Point2D> out = new ArrayList<>(stroke.size());
        for (Point p : stroke.getPoints()) {
            out.add(transform.transform(new Point2D.Double(p.getX(), p.getY()), null));
        }
        return out;
    }

    public int getCanvasSize() {
        return canvasSize;
    }

    public RenderPolicy getRenderPolicy() {
        return renderPolicy;
    }
}
