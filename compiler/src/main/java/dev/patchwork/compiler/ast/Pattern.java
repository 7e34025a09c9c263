package dev.patchwork.compiler.ast;

import java.util.List;

/**
 * Left-hand side of a {@code var} declaration.
 */
public abstract class Pattern extends Node {

    Pattern(SourcePosition position) {
        super(position);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitIdentifier(IdentifierPattern pattern);

        R visitIgnore(IgnorePattern pattern);

        R visitObject(ObjectPattern pattern);

        R visitArray(ArrayPattern pattern);
    }

    public static final class IdentifierPattern extends Pattern {
        public final String name;

        public IdentifierPattern(SourcePosition position, String name) {
            super(position);
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    /** {@code var _ = expr} */
    public static final class IgnorePattern extends Pattern {

        public IgnorePattern(SourcePosition position) {
            super(position);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIgnore(this);
        }
    }

    public static final class ObjectPattern extends Pattern {
        public final List<Field> fields;

        public ObjectPattern(SourcePosition position, List<Field> fields) {
            super(position);
            this.fields = List.copyOf(fields);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitObject(this);
        }
    }

    public static final class ArrayPattern extends Pattern {
        public final List<Pattern> elements;

        public ArrayPattern(SourcePosition position, List<Pattern> elements) {
            super(position);
            this.elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArray(this);
        }
    }

    /**
     * Object-destructuring entry; {@code binding} is null for the shorthand {@code {x}}.
     */
    public static final class Field {
        public final String key;
        public final Pattern binding;

        public Field(String key, Pattern binding) {
            this.key = key;
            this.binding = binding;
        }
    }
}
