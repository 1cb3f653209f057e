package com.inkglyph.server.ai.labels;

/**
 * Accepts code points in a closed range, e.g. the Hiragana block
 * U+3040..U+309F.
 */
public class UnicodeRangePolicy implements LabelFilterPolicy {

    public static final int HIRAGANA_START = 0x3040;
    public static final int HIRAGANA_END = 0x309F;

    private final int start;
    private final int end;

    public UnicodeRangePolicy(int start, int end) {
        if (start > end) {
            throw new IllegalArgumentException(String.format("Empty range U+%04X..U+%04X", start, end));
        }
        this.start = start;
        this.end = end;
    }

    public static UnicodeRangePolicy hiragana() {
        return new UnicodeRangePolicy(HIRAGANA_START, HIRAGANA_END);
    }

    @Override
    public boolean accepts(int codePoint) {
        return codePoint >= start && codePoint <= end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return String.format("U+%04X..U+%04X", start, end);
    }
}
