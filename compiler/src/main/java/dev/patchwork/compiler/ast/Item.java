package dev.patchwork.compiler.ast;

import java.util.List;

/**
 * Top-level declaration of a Patchwork program.
 */
public abstract class Item extends Node {

    Item(SourcePosition position) {
        super(position);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitImport(ImportDecl item);

        R visitSkill(SkillDecl item);

        R visitWorker(WorkerDecl item);

        R visitFunction(FunctionDecl item);

        R visitTrait(TraitDecl item);

        R visitType(TypeDecl item);
    }

    /**
     * {@code import std.log}, {@code import ./helpers} or {@code import ./{a, b}}.
     */
    public static final class ImportDecl extends Item {
        public final String path;
        public final List<String> members;

        public ImportDecl(SourcePosition position, String path, List<String> members) {
            super(position);
            this.path = path;
            this.members = List.copyOf(members);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImport(this);
        }
    }

    public static final class SkillDecl extends Item {
        public final String name;
        public final List<Param> params;
        public final Block body;

        public SkillDecl(SourcePosition position, String name, List<Param> params, Block body) {
            super(position);
            this.name = name;
            this.params = List.copyOf(params);
            this.body = body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSkill(this);
        }
    }

    /**
     * Agent-invocable unit. {@code keyword} records which surface spelling
     * ({@code worker} or {@code task}) declared it.
     */
    public static final class WorkerDecl extends Item {
        public final String keyword;
        public final String name;
        public final List<Param> params;
        public final Block body;

        public WorkerDecl(SourcePosition position, String keyword, String name, List<Param> params, Block body) {
            super(position);
            this.keyword = keyword;
            this.name = name;
            this.params = List.copyOf(params);
            this.body = body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWorker(this);
        }
    }

    public static final class FunctionDecl extends Item {
        public final String name;
        public final List<Param> params;
        public final Block body;
        public final boolean exported;

        public FunctionDecl(SourcePosition position, String name, List<Param> params, Block body, boolean exported) {
            super(position);
            this.name = name;
            this.params = List.copyOf(params);
            this.body = body;
            this.exported = exported;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunction(this);
        }
    }

    public static final class TraitDecl extends Item {
        public final String name;
        public final List<FunctionDecl> methods;

        public TraitDecl(SourcePosition position, String name, List<FunctionDecl> methods) {
            super(position);
            this.name = name;
            this.methods = List.copyOf(methods);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTrait(this);
        }
    }

    public static final class TypeDecl extends Item {
        public final String name;
        public final String definition;

        public TypeDecl(SourcePosition position, String name, String definition) {
            super(position);
            this.name = name;
            this.definition = definition;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitType(this);
        }
    }
}
