package com.inkglyph.server.ai.labels;

import java.util.Arrays;

/**
 * Immutable class index to glyph mapping for the retained classes, in ascending
 * class index order.
 */
public final class FilteredIndex {
    private final int[] classIndices;
    private final String[] glyphs;
    private final int totalClassCount;

    FilteredIndex(int[] classIndices, String[] glyphs, int totalClassCount) {
        this.classIndices = classIndices;
        this.glyphs = glyphs;
        this.totalClassCount = totalClassCount;
    }

    public int size() {
        return classIndices.length;
    }

    public int classIndexAt(int position) {
        return classIndices[position];
    }

    public String glyphAt(int position) {
        return glyphs[position];
    }

    /**
     * Glyph for a class index, or null when the class was filtered out.
     */
    public String glyphForClass(int classIndex) {
        int pos = Arrays.binarySearch(classIndices, classIndex);
        return pos >= 0 ? glyphs[pos] : null;
    }

    /**
     * Size of the full label vocabulary this index was built from, i.e. the
     * expected length of a raw score vector.
     */
    public int getTotalClassCount() {
        return totalClassCount;
    }
}
