package dev.patchwork.compiler.ast;

import java.util.Objects;

/**
 * One-based line and column of the first character of a node in its source file.
 */
public final class SourcePosition {

    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

    public final int line;
    public final int column;

    public SourcePosition(int line, int column) {
        this.line = line;
        this.column = column;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SourcePosition)) {
            return false;
        }
        SourcePosition that = (SourcePosition) other;
        return line == that.line && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
