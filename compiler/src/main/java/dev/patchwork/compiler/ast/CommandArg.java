package dev.patchwork.compiler.ast;

/**
 * Argument of a {@link Expr.BareCommand}.
 */
public abstract class CommandArg {

    CommandArg() {
    }

    /** Shell word, inserted into the command template as written. */
    public static final class Literal extends CommandArg {
        public final String text;

        public Literal(String text) {
            this.text = text;
        }
    }

    public static final class Str extends CommandArg {
        public final Expr.StringLiteral value;

        public Str(Expr.StringLiteral value) {
            this.value = value;
        }
    }

    /** Nested {@code $( ... )} in argument position. */
    public static final class Substitution extends CommandArg {
        public final Expr command;

        public Substitution(Expr command) {
            this.command = command;
        }
    }
}
