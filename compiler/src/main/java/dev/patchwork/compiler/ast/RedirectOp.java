package dev.patchwork.compiler.ast;

public enum RedirectOp {
    OUT(">"),
    APPEND(">>"),
    IN("<"),
    ERR_OUT("2>"),
    ERR_TO_OUT("2>&1");

    private final String symbol;

    RedirectOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** {@code 2>&1} is the only operator without a target. */
    public boolean takesTarget() {
        return this != ERR_TO_OUT;
    }
}
