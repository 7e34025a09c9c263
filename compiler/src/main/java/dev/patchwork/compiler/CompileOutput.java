package dev.patchwork.compiler;

/**
 * Generated JavaScript module for one source file.
 */
public final class CompileOutput {

    private final String sourceName;
    private final String javascript;
    private final String runtimeModule;

    public CompileOutput(String sourceName, String javascript, String runtimeModule) {
        this.sourceName = sourceName;
        this.javascript = javascript;
        this.runtimeModule = runtimeModule;
    }

    public String sourceName() {
        return sourceName;
    }

    public String javascript() {
        return javascript;
    }

    /** Module path the generated code imports its runtime helpers from. */
    public String runtimeModule() {
        return runtimeModule;
    }
}
