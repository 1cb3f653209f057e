package com.inkglyph.server.ai.render;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.geom.Path2D;
import java.awt.geom.Point2D;
import java.util.List;

/**
 * Black round-capped polyline on white. The width is fixed in canvas pixels and
 * does not follow the fit scale.
 *
 * <p>
 * A stroke with a single point (a tap without movement) paints nothing.
 */
public class RoundPenRenderPolicy implements RenderPolicy {

    private final float strokeWidth;
    private final Color foreground;
    private final Color background;

    public RoundPenRenderPolicy(float strokeWidth) {
        this(strokeWidth, Color.BLACK, Color.WHITE);
    }

    public RoundPenRenderPolicy(float strokeWidth, Color foreground, Color background) {
        if (strokeWidth <= 0f) {
            throw new IllegalArgumentException("strokeWidth must be positive");
        }
        this.strokeWidth = strokeWidth;
        this.foreground = foreground;
        this.background = background;
    }

    @Override
    public Color background() {
        return background;
    }

    @Override
    public void paintStroke(Graphics2D g, List<Point2D> points) {
        if (points.size() < 2) {
            return;
        }
        Path2D.Double path = new Path2D.Double();
        Point2D first = points.get(0);
        path.moveTo(first.getX(), first.getY());
        for (int i = 1; i < points.size(); i++) {
            Point2D p = points.get(i);
            path.lineTo(p.getX(), p.getY());
        }
        g.setColor(foreground);
        g.setStroke(new BasicStroke(strokeWidth, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
        g.draw(path);
    }

    public float getStrokeWidth() {
        return strokeWidth;
    }
}
