package dev.patchwork.compiler.ast;

public enum UnaryOp {
    NOT,
    NEG,
    THROW
}
