package dev.patchwork.compiler.ast;

public enum BinaryOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    EQ("=="),
    NOT_EQ("!="),
    LT("<"),
    GT(">"),
    AND("&&"),
    OR("||"),
    ASSIGN("="),
    /** Generic {@code a | b}; only shell pipelines have a lowering. */
    PIPE("|"),
    RANGE("...");

    private final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    /** Surface spelling in Patchwork source. */
    public String symbol() {
        return symbol;
    }
}
