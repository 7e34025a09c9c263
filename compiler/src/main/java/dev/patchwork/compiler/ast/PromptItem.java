package dev.patchwork.compiler.ast;

public abstract class PromptItem {

    PromptItem() {
    }

    public static final class Text extends PromptItem {
        public final String value;

        public Text(String value) {
            this.value = value;
        }
    }

    /** {@code do { ... }} nested in prompt text. */
    public static final class Code extends PromptItem {
        public final Block block;

        public Code(Block block) {
            this.block = block;
        }
    }

    public static final class Interpolation extends PromptItem {
        public final Expr expression;

        public Interpolation(Expr expression) {
            this.expression = expression;
        }
    }
}
