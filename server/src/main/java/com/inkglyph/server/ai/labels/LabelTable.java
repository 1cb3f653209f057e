package com.inkglyph.server.ai.labels;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Class index to label string, exactly as listed in the label file.
 */
public final class LabelTable {
    private final List<String> labels;

    public LabelTable(List<String> labels) {
        this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
    }

    /**
     * Parses newline-delimited label text. Line index is class index; trailing
     * blank lines are dropped, blank lines in between keep their slot.
     */
    public static LabelTable parse(String text) {
        List<String> lines = new ArrayList<>();
        if (text != null && !text.isEmpty()) {
            for (String line : text.split("\n", -1)) {
                lines.add(stripCarriageReturn(line));
            }
        }
        int end = lines.size();
        while (end > 0 && lines.get(end - 1).isBlank()) {
            end--;
        }
        return new LabelTable(lines.subList(0, end));
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    public int size() {
        return labels.size();
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    public String get(int classIndex) {
        return labels.get(classIndex);
    }

    public List<String> asList() {
        return labels;
    }
}
