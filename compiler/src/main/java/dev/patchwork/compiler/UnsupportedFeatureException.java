package dev.patchwork.compiler;

/**
 * A construct that parses but has no JavaScript lowering yet.
 */
public class UnsupportedFeatureException extends CompileException {

    private final String feature;

    public UnsupportedFeatureException(String sourceName, int line, int column, String feature) {
        super(Kind.UNSUPPORTED_FEATURE, sourceName, line, column, feature + " is not supported");
        this.feature = feature;
    }

    public String getFeature() { return feature; }
}
