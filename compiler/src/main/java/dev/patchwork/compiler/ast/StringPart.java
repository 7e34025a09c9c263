package dev.patchwork.compiler.ast;

/**
 * Segment of a string literal: decoded text or an embedded {@code ${expr}}.
 */
public abstract class StringPart {

    StringPart() {
    }

    public static final class Text extends StringPart {
        public final String value;

        public Text(String value) {
            this.value = value;
        }
    }

    public static final class Interpolation extends StringPart {
        public final Expr expression;

        public Interpolation(Expr expression) {
            this.expression = expression;
        }
    }
}
