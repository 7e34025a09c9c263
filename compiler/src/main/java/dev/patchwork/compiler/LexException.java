package dev.patchwork.compiler;

/**
 * Malformed input found by the lexer. The span is a half-open range of character
 * offsets into the source text.
 */
public class LexException extends CompileException {

    private final int spanStart;
    private final int spanEnd;

    public LexException(String sourceName, int line, int column, int spanStart, int spanEnd, String detail) {
        super(Kind.LEX, sourceName, line, column, detail + " at [" + spanStart + ", " + spanEnd + ")");
        this.spanStart = spanStart;
        this.spanEnd = spanEnd;
    }

    public int getSpanStart() { return spanStart; }

    public int getSpanEnd() { return spanEnd; }
}
