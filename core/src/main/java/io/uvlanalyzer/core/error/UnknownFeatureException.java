package io.uvlanalyzer.core.error;

/**
 * Thrown when an operation parameter names a feature that the model does not declare. URN:
 * {@code urn:uvl-analyzer:error:unknown-feature}
 */
public final class UnknownFeatureException extends AnalysisEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:uvl-analyzer:error:unknown-feature";

    private final String featureName;

    public UnknownFeatureException(String featureName) {
        this(featureName, null);
    }

    public UnknownFeatureException(String featureName, String operation) {
        super("Unknown feature: '" + featureName + "'", operation);
        this.featureName = featureName;
    }

    /** The feature name that could not be resolved. */
    public String featureName() {
        return featureName;
    }

    @Override
    public String urn() {
        return URN;
    }
}
