package com.inkglyph.server.ai.labels;

import com.inkglyph.server.ai.InitializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces the model vocabulary to the target alphabet.
 *
 * <p>
 * Only the leading character of each label is looked at. Labels such as
 * "あ_1" or multi-character entries collapse to their first glyph; the rest of
 * the label is ignored.
 */
public class LabelFilter {

    private static final Logger logger = LoggerFactory.getLogger(LabelFilter.class);

    private final LabelFilterPolicy policy;

    public LabelFilter(LabelFilterPolicy policy) {
        this.policy = policy;
    }

    public FilteredIndex build(LabelTable table) {
        if (table == null || table.isEmpty()) {
            throw new InitializationException("Label list is empty");
        }

        List<Integer> indices = new ArrayList<>();
        List<String> glyphs = new ArrayList<>();
        for (int i = 0; i < table.size(); i++) {
            String label = table.get(i);
            if (label.isEmpty()) {
                continue;
            }
            int codePoint = label.codePointAt(0);
            if (policy.accepts(codePoint)) {
                indices.add(i);
                glyphs.add(new String(Character.toChars(codePoint)));
            }
        }

        if (indices.isEmpty()) {
            throw new InitializationException(
                    "None of the " + table.size() + " labels falls into " + policy);
        }

        int[] idx = new int[indices.size()];
        for (int i = 0; i < idx.length; i++) {
            idx[i] = indices.get(i);
        }
        logger.info("Label filter kept {} of {} classes ({})", idx.length, table.size(), policy);
        return new FilteredIndex(idx, glyphs.toArray(new String[0]), table.size());
    }
}
