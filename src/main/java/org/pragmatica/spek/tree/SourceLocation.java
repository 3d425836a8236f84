package org.pragmatica.spek.tree;

/**
 * A position in script source (line and column, both 1-based, plus the 0-based character offset).
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Whether this location precedes the other one in the source text.
     */
    public boolean isBefore(SourceLocation other) {
        return offset < other.offset;
    }

    /**
     * Location of the first column on the same line, used for indentation diagnostics.
     */
    public SourceLocation lineStart() {
        return new SourceLocation(line, 1, offset - (column - 1));
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
