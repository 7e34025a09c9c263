package dev.patchwork.compiler;

public class ParseException extends CompileException {

    private final String offendingToken;

    public ParseException(String sourceName, int line, int column, String offendingToken, String detail) {
        super(Kind.PARSE, sourceName, line, column, detail);
        this.offendingToken = offendingToken;
    }

    /** Text of the token the parser stopped at, {@code <EOF>} at end of input. */
    public String getOffendingToken() { return offendingToken; }
}
