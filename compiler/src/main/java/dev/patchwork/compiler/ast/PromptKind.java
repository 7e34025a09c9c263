package dev.patchwork.compiler.ast;

public enum PromptKind {
    THINK("think"),
    ASK("ask");

    private final String keyword;

    PromptKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
