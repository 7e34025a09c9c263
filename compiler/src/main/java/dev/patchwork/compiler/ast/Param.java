package dev.patchwork.compiler.ast;

/**
 * Declared parameter. The type annotation is kept as raw text and never checked.
 */
public final class Param {

    public final String name;
    public final String typeAnnotation;

    public Param(String name, String typeAnnotation) {
        this.name = name;
        this.typeAnnotation = typeAnnotation;
    }
}
