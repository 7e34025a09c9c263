package dev.patchwork.compiler.ast;

import java.util.List;

public final class Program {

    public final List<Item> items;

    public Program(List<Item> items) {
        this.items = List.copyOf(items);
    }
}
