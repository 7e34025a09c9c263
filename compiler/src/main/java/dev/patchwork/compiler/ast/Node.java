package dev.patchwork.compiler.ast;

import java.util.Objects;

/**
 * Base of every statement and expression node. Nodes own copies of the text they
 * were built from, so a tree stays valid after the source buffer is released.
 */
public abstract class Node {

    public final SourcePosition position;

    protected Node(SourcePosition position) {
        this.position = Objects.requireNonNull(position, "position");
    }
}
