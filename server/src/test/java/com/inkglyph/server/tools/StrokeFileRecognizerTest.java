package com.inkglyph.server.tools;

import com.inkglyph.server.ink.Point;
import com.inkglyph.server.ink.SessionSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class StrokeFileRecognizerTest {

    @Test
    public void testReadStrokes(@TempDir Path dir) throws IOException {
        File file = dir.resolve("sample.json").toFile();
        Files.write(file.toPath(), ("{\"strokes\": [[{\"x\": 10, \"y\": 12}, {\"x\": 20.5, \"y\": 12}],"
                + " [{\"x\": 5, \"y\": 5}]]}").getBytes(StandardCharsets.UTF_8));

        SessionSnapshot snapshot = StrokeFileRecognizer.readStrokes(file);

        assertEquals(2, snapshot.getStrokes().size());
        assertEquals(3, snapshot.pointCount());
        assertEquals(new Point(20.5, 12), snapshot.getStrokes().get(0).getPoints().get(1));
        assertFalse(snapshot.hasActiveStroke());
    }

    @Test
    public void testMissingStrokesArray(@TempDir Path dir) throws IOException {
        File file = dir.resolve("bad.json").toFile();
        Files.write(file.toPath(), "{\"points\": []}".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> StrokeFileRecognizer.readStrokes(file));
    }
}
