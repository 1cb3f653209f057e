package com.inkglyph.server.ai.labels;

import com.inkglyph.server.ai.InitializationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class LabelTableTest {

    @Test
    public void testTrailingBlankLinesIgnored() {
        LabelTable table = LabelTable.parse("あ\nい\n\n\n");
        assertEquals(2, table.size());
        assertEquals("い", table.get(1));
    }

    @Test
    public void testInnerBlankLineKeepsItsIndex() {
        LabelTable table = LabelTable.parse("あ\n\nX\n");
        assertEquals(3, table.size());
        assertEquals("", table.get(1));
        assertEquals("X", table.get(2));
    }

    @Test
    public void testWindowsLineEndings() {
        LabelTable table = LabelTable.parse("あ\r\nい\r\n");
        assertEquals(2, table.size());
        assertEquals("あ", table.get(0));
    }

    @Test
    public void testEmptyText() {
        assertTrue(LabelTable.parse("").isEmpty());
        assertTrue(LabelTable.parse(null).isEmpty());
    }

    @Test
    public void testReadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("labels.txt");
        Files.write(file, "あ\nA\n".getBytes(StandardCharsets.UTF_8));
        LabelTable table = LabelFileReader.read(file);
        assertEquals(2, table.size());
    }

    @Test
    public void testReadFallsBackToClasspath() {
        LabelTable table = LabelFileReader.read(Path.of("does-not-exist", "test_labels.txt"));
        assertEquals(8, table.size());
        assertEquals("A", table.get(2));
    }

    @Test
    public void testMissingLabelFile() {
        assertThrows(InitializationException.class,
                () -> LabelFileReader.read(Path.of("does-not-exist", "no_such_labels.txt")));
    }
}
