package org.clyze.source.callsite.source.model;

import java.util.ArrayList;
import java.util.List;

/** Translates line/column positions to offsets in the text of a source file. */
public class LineMap {
    private final String text;
    /** The offset where each line starts (index 0 is line 1). */
    private final int[] lineStarts;

    public LineMap(String text) {
        this.text = text;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                if (i + 1 < length && text.charAt(i + 1) == '\n')
                    i++;
                starts.add(i + 1);
            } else if (c == '\n')
                starts.add(i + 1);
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Returns the text offset of a position.
     * @param line      the 1-based line
     * @param column    the 1-based column
     * @return          the offset in the text, clamped to the text length
     */
    public int offsetOf(int line, int column) {
        if (line < 1 || line > lineStarts.length)
            throw new IllegalArgumentException("Line " + line + " out of range 1.." + lineStarts.length);
        return Math.min(lineStarts[line - 1] + column - 1, text.length());
    }

    public String slice(TextRange range) {
        if (!range.isKnown())
            throw new IllegalArgumentException("Range has no position information");
        return text.substring(offsetOf(range.startLine, range.startColumn), offsetOf(range.endLine, range.endColumn));
    }
}
