package dev.patchwork.compiler.ast;

public abstract class Statement extends Node {

    Statement(SourcePosition position) {
        super(position);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitVarDecl(VarDecl statement);

        R visitExpression(ExprStatement statement);

        R visitIf(If statement);

        R visitWhile(While statement);

        R visitForIn(ForIn statement);

        R visitReturn(Return statement);

        R visitBreak(Break statement);

        R visitSucceed(Succeed statement);

        R visitTypeDecl(TypeDeclaration statement);
    }

    /**
     * {@code var pattern[: type] [= initializer]}; type and initializer may be null.
     */
    public static final class VarDecl extends Statement {
        public final Pattern pattern;
        public final String typeAnnotation;
        public final Expr initializer;

        public VarDecl(SourcePosition position, Pattern pattern, String typeAnnotation, Expr initializer) {
            super(position);
            this.pattern = pattern;
            this.typeAnnotation = typeAnnotation;
            this.initializer = initializer;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVarDecl(this);
        }
    }

    public static final class ExprStatement extends Statement {
        public final Expr expression;

        public ExprStatement(SourcePosition position, Expr expression) {
            super(position);
            this.expression = expression;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpression(this);
        }
    }

    /**
     * {@code elseBlock} is null without an else branch; an {@code else if} is an else
     * block holding a single nested {@code If}.
     */
    public static final class If extends Statement {
        public final Expr condition;
        public final Block thenBlock;
        public final Block elseBlock;

        public If(SourcePosition position, Expr condition, Block thenBlock, Block elseBlock) {
            super(position);
            this.condition = condition;
            this.thenBlock = thenBlock;
            this.elseBlock = elseBlock;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    public static final class While extends Statement {
        public final Expr condition;
        public final Block body;

        public While(SourcePosition position, Expr condition, Block body) {
            super(position);
            this.condition = condition;
            this.body = body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    public static final class ForIn extends Statement {
        public final String variable;
        public final Expr iterable;
        public final Block body;

        public ForIn(SourcePosition position, String variable, Expr iterable, Block body) {
            super(position);
            this.variable = variable;
            this.iterable = iterable;
            this.body = body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitForIn(this);
        }
    }

    public static final class Return extends Statement {
        public final Expr value;

        public Return(SourcePosition position, Expr value) {
            super(position);
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    public static final class Break extends Statement {

        public Break(SourcePosition position) {
            super(position);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreak(this);
        }
    }

    /** Worker-terminal signal, interpreted by the host runtime. */
    public static final class Succeed extends Statement {

        public Succeed(SourcePosition position) {
            super(position);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSucceed(this);
        }
    }

    public static final class TypeDeclaration extends Statement {
        public final String name;
        public final String definition;

        public TypeDeclaration(SourcePosition position, String name, String definition) {
            super(position);
            this.name = name;
            this.definition = definition;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTypeDecl(this);
        }
    }
}
