package dev.patchwork.compiler.ast;

import java.util.List;

public final class Block {

    public final List<Statement> statements;

    public Block(List<Statement> statements) {
        this.statements = List.copyOf(statements);
    }
}
