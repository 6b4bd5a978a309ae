package org.clyze.source.callsite.source.model;

import java.util.Objects;

/**
 * A region in a source file. Lines and columns are 1-based, the end column
 * points just past the last character. Unknown positions use -1.
 */
public class TextRange {
    public static final TextRange UNKNOWN = new TextRange(-1, -1, -1, -1);

    public final int startLine;
    public final int startColumn;
    public final int endLine;
    public final int endColumn;

    public TextRange(int startLine, int startColumn, int endLine, int endColumn) {
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public boolean isKnown() {
        return startLine > 0 && endLine > 0;
    }

    public boolean coversLine(int line) {
        return isKnown() && startLine <= line && line <= endLine;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object)
            return true;
        if (!(object instanceof TextRange))
            return false;
        TextRange that = (TextRange) object;
        return startLine == that.startLine && startColumn == that.startColumn &&
                endLine == that.endLine && endColumn == that.endColumn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startLine, startColumn, endLine, endColumn);
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
