package dev.patchwork.compiler;

/**
 * Terminal failure of one compilation unit. Nothing is emitted when one is thrown.
 *
 * <p>The message reads {@code source:line:col: [KIND] detail}.
 */
public class CompileException extends RuntimeException {

    public enum Kind { LEX, PARSE, UNSUPPORTED_FEATURE, INVALID_SESSION_ACCESS }

    private final Kind kind;
    private final String sourceName;
    private final int line;
    private final int column;
    private final String detail;

    public CompileException(Kind kind, String sourceName, int line, int column, String detail) {
        this(kind, sourceName, line, column, detail, null);
    }

    public CompileException(Kind kind, String sourceName, int line, int column, String detail, Throwable cause) {
        super(format(kind, sourceName, line, column, detail), cause);
        this.kind = kind;
        this.sourceName = sourceName;
        this.line = line;
        this.column = column;
        this.detail = detail;
    }

    private static String format(Kind kind, String sourceName, int line, int column, String detail) {
        StringBuilder message = new StringBuilder(sourceName);
        if (line > 0) {
            message.append(':').append(line).append(':').append(column);
        }
        return message.append(": [").append(kind).append("] ").append(detail).toString();
    }

    public Kind getKind() { return kind; }

    public String getSourceName() { return sourceName; }

    /** One-based; 0 when the position is unknown. */
    public int getLine() { return line; }

    public int getColumn() { return column; }

    /** Message without the location prefix. */
    public String getDetail() { return detail; }
}
