package dev.patchwork.compiler.ast;

/**
 * Joins the commands of a {@link Expr.ShellChain}.
 */
public enum ShellOperator {
    PIPE("|"),
    AND("&&"),
    OR("||");

    private final String symbol;

    ShellOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
