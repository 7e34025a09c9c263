package dev.patchwork.compiler;

public class InvalidSessionAccessException extends CompileException {

    private final String accessPath;

    public InvalidSessionAccessException(String sourceName, int line, int column, String accessPath, String detail) {
        super(Kind.INVALID_SESSION_ACCESS, sourceName, line, column, detail);
        this.accessPath = accessPath;
    }

    /** Dotted path as written, e.g. {@code self.session.user}. */
    public String getAccessPath() { return accessPath; }
}
