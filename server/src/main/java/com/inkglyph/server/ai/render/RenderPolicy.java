package com.inkglyph.server.ai.render;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.geom.Point2D;
import java.util.List;

/**
 * Decides how one transformed stroke is painted onto the recognition canvas.
 */
public interface RenderPolicy {

    Color background();

    /**
     * Paints a stroke whose points are already in canvas coordinates.
     */
    void paintStroke(Graphics2D g, List<Point2D> points);
}
