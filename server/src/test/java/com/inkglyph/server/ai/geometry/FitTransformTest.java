package com.inkglyph.server.ai.geometry;

import org.junit.jupiter.api.Test;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class FitTransformTest {

    private final FitTransform fit = new FitTransform(300.0, 80.0, 220.0);

    @Test
    public void testNaturalSizeIsKept() {
        BoundingBox box = new BoundingBox(4, 4, 96, 16);
        assertEquals(1.0, fit.scaleFactor(box), 0.0);

        AffineTransform t = fit.compute(box);
        Point2D first = t.transform(new Point2D.Double(10, 10), null);
        Point2D last = t.transform(new Point2D.Double(90, 10), null);
        assertEquals(110.0, first.getX(), 1e-9);
        assertEquals(150.0, first.getY(), 1e-9);
        assertEquals(190.0, last.getX(), 1e-9);
        assertEquals(150.0, last.getY(), 1e-9);
    }

    @Test
    public void testSmallInputIsScaledUpToMinSize() {
        BoundingBox box = new BoundingBox(100, 100, 140, 120);
        assertEquals(2.0, fit.scaleFactor(box), 1e-12);

        AffineTransform t = fit.compute(box);
        Point2D corner = t.transform(new Point2D.Double(100, 100), null);
        // (100 - 120) * 2 + 150
        assertEquals(110.0, corner.getX(), 1e-9);
        assertEquals(130.0, corner.getY(), 1e-9);
    }

    @Test
    public void testLargeInputIsScaledDownToMaxSize() {
        BoundingBox box = new BoundingBox(0, 0, 300, 150);
        assertEquals(220.0 / 300.0, fit.scaleFactor(box), 1e-12);

        AffineTransform t = fit.compute(box);
        Point2D left = t.transform(new Point2D.Double(0, 75), null);
        Point2D right = t.transform(new Point2D.Double(300, 75), null);
        assertEquals(220.0, right.getX() - left.getX(), 1e-9);
    }

    @Test
    public void testBoundariesOfRangeAreNotRescaled() {
        assertEquals(1.0, fit.scaleFactor(new BoundingBox(0, 0, 80, 10)), 0.0);
        assertEquals(1.0, fit.scaleFactor(new BoundingBox(0, 0, 10, 220)), 0.0);
        assertEquals(150.0, fit.targetSize(150.0), 0.0);
    }

    @Test
    public void testDegenerateBoxUsesUnitScale() {
        BoundingBox point = new BoundingBox(42, 24, 42, 24);
        assertEquals(1.0, fit.scaleFactor(point), 0.0);

        Point2D mapped = fit.compute(point).transform(new Point2D.Double(42, 24), null);
        assertEquals(150.0, mapped.getX(), 1e-9);
        assertEquals(150.0, mapped.getY(), 1e-9);
    }

    @Test
    public void testBoxCenterAlwaysMapsToCanvasCenter() {
        Random random = new Random(11);
        for (int i = 0; i < 500; i++) {
            double x0 = random.nextDouble() * 400 - 50;
            double y0 = random.nextDouble() * 400 - 50;
            double w = random.nextInt(5) == 0 ? 0.0 : random.nextDouble() * 400;
            double h = random.nextInt(5) == 0 ? 0.0 : random.nextDouble() * 400;
            BoundingBox box = new BoundingBox(x0, y0, x0 + w, y0 + h);

            Point2D center = fit.compute(box).transform(new Point2D.Double(box.centerX(), box.centerY()), null);
            assertEquals(150.0, center.getX(), 1e-9);
            assertEquals(150.0, center.getY(), 1e-9);

            double raw = box.longerSide();
            if (raw >= 80.0 && raw <= 220.0) {
                assertEquals(1.0, fit.scaleFactor(box), 0.0);
            } else if (raw > 0.0) {
                double target = raw < 80.0 ? 80.0 : 220.0;
                assertEquals(target, raw * fit.scaleFactor(box), 1e-9);
            }
        }
    }

    @Test
    public void testInvertedRangeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FitTransform(300, 220, 80));
    }
}
