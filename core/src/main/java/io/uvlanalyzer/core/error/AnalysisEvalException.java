package io.uvlanalyzer.core.error;

/**
 * Abstract parent for errors raised while an analysis runs against an already parsed model.
 * Carries the name of the operation that failed, or {@code null} when the failure happened
 * outside the dispatcher.
 */
public abstract class AnalysisEvalException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final String operation;

    protected AnalysisEvalException(String message, String operation) {
        super(message, Phase.ANALYSIS);
        this.operation = operation;
    }

    protected AnalysisEvalException(String message, Throwable cause, String operation) {
        super(message, cause, Phase.ANALYSIS);
        this.operation = operation;
    }

    /** The operation wire name, or {@code null} if unknown. */
    public String operation() {
        return operation;
    }
}
