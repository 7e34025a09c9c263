package dev.patchwork.compiler.ast;

import java.util.List;

public abstract class Expr extends Node {

    Expr(SourcePosition position) {
        super(position);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitIdentifier(Identifier expr);

        R visitNumber(NumberLiteral expr);

        R visitString(StringLiteral expr);

        R visitBoolean(BooleanLiteral expr);

        R visitArray(ArrayLiteral expr);

        R visitObject(ObjectLiteral expr);

        R visitBinary(Binary expr);

        R visitUnary(Unary expr);

        R visitCall(Call expr);

        R visitMember(Member expr);

        R visitIndex(Index expr);

        R visitParen(Paren expr);

        R visitPostIncrement(PostIncrement expr);

        R visitPostDecrement(PostDecrement expr);

        R visitAwait(Await expr);

        R visitBareCommand(BareCommand expr);

        R visitCommandSubstitution(CommandSubstitution expr);

        R visitShellChain(ShellChain expr);

        R visitShellRedirect(ShellRedirect expr);

        R visitPrompt(Prompt expr);

        R visitDo(Do expr);
    }

    public static final class Identifier extends Expr {
        public final String name;

        public Identifier(SourcePosition position, String name) {
            super(position);
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    /**
     * Number kept exactly as written so that {@code 1.50} is emitted as {@code 1.50}.
     */
    public static final class NumberLiteral extends Expr {
        public final String text;

        public NumberLiteral(SourcePosition position, String text) {
            super(position);
            this.text = text;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    /**
     * String literal as an ordered list of decoded text runs and interpolations.
     * Adjacent text runs are merged by the builder, and {@code ""} holds a single
     * empty text part.
     */
    public static final class StringLiteral extends Expr {
        public final List<StringPart> parts;

        public StringLiteral(SourcePosition position, List<StringPart> parts) {
            super(position);
            this.parts = List.copyOf(parts);
        }

        /**
         * True iff the literal is exactly one text part.
         */
        public boolean isPlainText() {
            return parts.size() == 1 && parts.get(0) instanceof StringPart.Text;
        }

        public String plainText() {
            if (!isPlainText()) {
                throw new IllegalStateException("string literal has interpolations");
            }
            return ((StringPart.Text) parts.get(0)).value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    public static final class BooleanLiteral extends Expr {
        public final boolean value;

        public BooleanLiteral(SourcePosition position, boolean value) {
            super(position);
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    public static final class ArrayLiteral extends Expr {
        public final List<Expr> elements;

        public ArrayLiteral(SourcePosition position, List<Expr> elements) {
            super(position);
            this.elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArray(this);
        }
    }

    public static final class ObjectLiteral extends Expr {
        public final List<ObjectField> fields;

        public ObjectLiteral(SourcePosition position, List<ObjectField> fields) {
            super(position);
            this.fields = List.copyOf(fields);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitObject(this);
        }
    }

    /**
     * {@code value} is null for shorthand {@code {x}}, which stands for {@code {x: x}}.
     */
    public static final class ObjectField {
        public final String key;
        public final Expr value;

        public ObjectField(String key, Expr value) {
            this.key = key;
            this.value = value;
        }
    }

    public static final class Binary extends Expr {
        public final BinaryOp operator;
        public final Expr left;
        public final Expr right;

        public Binary(SourcePosition position, BinaryOp operator, Expr left, Expr right) {
            super(position);
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    public static final class Unary extends Expr {
        public final UnaryOp operator;
        public final Expr operand;

        public Unary(SourcePosition position, UnaryOp operator, Expr operand) {
            super(position);
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    public static final class Call extends Expr {
        public final Expr callee;
        public final List<Expr> arguments;

        public Call(SourcePosition position, Expr callee, List<Expr> arguments) {
            super(position);
            this.callee = callee;
            this.arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    public static final class Member extends Expr {
        public final Expr target;
        public final String property;

        public Member(SourcePosition position, Expr target, String property) {
            super(position);
            this.target = target;
            this.property = property;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMember(this);
        }
    }

    public static final class Index extends Expr {
        public final Expr target;
        public final Expr index;

        public Index(SourcePosition position, Expr target, Expr index) {
            super(position);
            this.target = target;
            this.index = index;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndex(this);
        }
    }

    public static final class Paren extends Expr {
        public final Expr inner;

        public Paren(SourcePosition position, Expr inner) {
            super(position);
            this.inner = inner;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParen(this);
        }
    }

    public static final class PostIncrement extends Expr {
        public final Expr operand;

        public PostIncrement(SourcePosition position, Expr operand) {
            super(position);
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPostIncrement(this);
        }
    }

    public static final class PostDecrement extends Expr {
        public final Expr operand;

        public PostDecrement(SourcePosition position, Expr operand) {
            super(position);
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPostDecrement(this);
        }
    }

    public static final class Await extends Expr {
        public final Expr operand;

        public Await(SourcePosition position, Expr operand) {
            super(position);
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAwait(this);
        }
    }

    /**
     * {@code $ name arg ...} or a command inside {@code $( ... )}.
     */
    public static final class BareCommand extends Expr {
        public final String name;
        public final List<CommandArg> arguments;

        public BareCommand(SourcePosition position, String name, List<CommandArg> arguments) {
            super(position);
            this.name = name;
            this.arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBareCommand(this);
        }
    }

    public static final class CommandSubstitution extends Expr {
        public final Expr command;

        public CommandSubstitution(SourcePosition position, Expr command) {
            super(position);
            this.command = command;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCommandSubstitution(this);
        }
    }

    /**
     * Commands joined by one operator. Mixed operators nest: {@code a && b || c} is an
     * OR chain whose first command is the AND chain {@code a && b}.
     */
    public static final class ShellChain extends Expr {
        public final ShellOperator operator;
        public final List<Expr> commands;

        public ShellChain(SourcePosition position, ShellOperator operator, List<Expr> commands) {
            super(position);
            this.operator = operator;
            this.commands = List.copyOf(commands);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitShellChain(this);
        }
    }

    /**
     * {@code target} is null for {@link RedirectOp#ERR_TO_OUT}.
     */
    public static final class ShellRedirect extends Expr {
        public final Expr command;
        public final RedirectOp operator;
        public final Expr target;

        public ShellRedirect(SourcePosition position, Expr command, RedirectOp operator, Expr target) {
            super(position);
            this.command = command;
            this.operator = operator;
            this.target = target;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitShellRedirect(this);
        }
    }

    public static final class Prompt extends Expr {
        public final PromptKind kind;
        public final List<PromptItem> items;

        public Prompt(SourcePosition position, PromptKind kind, List<PromptItem> items) {
            super(position);
            this.kind = kind;
            this.items = List.copyOf(items);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPrompt(this);
        }
    }

    /** Standalone {@code do { ... }} in code position. */
    public static final class Do extends Expr {
        public final Block body;

        public Do(SourcePosition position, Block body) {
            super(position);
            this.body = body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDo(this);
        }
    }
}
