package com.inkglyph.server.ai;

import com.inkglyph.server.config.RecognizerConfiguration;
import com.inkglyph.server.config.RecognizerSettings;
import com.inkglyph.server.ink.Point;
import com.inkglyph.server.ink.SessionSnapshot;
import com.inkglyph.server.ink.StrokeSession;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InkCaptureTest {

    private final InkCapture capture = RecognizerConfiguration.buildCapture(RecognizerSettings.defaults());

    private static int gray(int rgb) {
        return (((rgb >> 16) & 0xff) + ((rgb >> 8) & 0xff) + (rgb & 0xff)) / 3;
    }

    @Test
    public void testCollinearStrokeIsCenteredAtNaturalSize() {
        SessionSnapshot snapshot = SessionSnapshot.of(List.of(
                List.of(new Point(10, 10), new Point(50, 10), new Point(90, 10))));

        CaptureResult result = capture.capture(snapshot);

        assertFalse(result.isEmpty());
        assertEquals(4.0, result.getBounds().getMinX(), 1e-9);
        assertEquals(4.0, result.getBounds().getMinY(), 1e-9);
        assertEquals(96.0, result.getBounds().getMaxX(), 1e-9);
        assertEquals(16.0, result.getBounds().getMaxY(), 1e-9);
        assertEquals(1.0, result.getScale(), 0.0);

        // Stroke now runs from (110,150) to (190,150)
        assertTrue(gray(result.getRaster().getRgb(150, 150)) < 40);
        assertTrue(gray(result.getRaster().getRgb(112, 150)) < 40);
        assertEquals(0xffffff, result.getRaster().getRgb(10, 10), "Original position is blank after centering");
        assertEquals(0xffffff, result.getRaster().getRgb(230, 150));
    }

    @Test
    public void testTinyDrawingIsScaledUp() {
        SessionSnapshot snapshot = SessionSnapshot.of(List.of(
                List.of(new Point(100, 100), new Point(108, 100))));

        CaptureResult result = capture.capture(snapshot);
        // padded box is 20 x 12
        assertEquals(4.0, result.getScale(), 1e-9);
        // ends at 150 +- 16
        assertTrue(gray(result.getRaster().getRgb(165, 150)) < 40);
    }

    @Test
    public void testEmptyAndClearedSessions() {
        assertTrue(capture.capture(SessionSnapshot.empty()).isEmpty());
        assertTrue(capture.capture(null).isEmpty());

        StrokeSession session = new StrokeSession();
        session.beginStroke(new Point(1, 1));
        session.extendStroke(new Point(30, 30));
        session.endStroke();
        session.clear();
        assertTrue(capture.capture(session.snapshot()).isEmpty());
    }
}
