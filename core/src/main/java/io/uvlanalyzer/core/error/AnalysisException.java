package io.uvlanalyzer.core.error;

/**
 * Abstract base for all uvl-analyzer exceptions. Never thrown directly; use the concrete
 * subclasses under {@link ModelLoadException} or {@link AnalysisEvalException}.
 *
 * <p>
 * Internal inconsistencies (for example a clause that references a variable the encoder never
 * declared) are not part of this hierarchy: they surface as {@link IllegalStateException} and
 * are never caught by the engine.
 */
public abstract class AnalysisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        ANALYSIS
    }

    private final Phase phase;

    protected AnalysisException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected AnalysisException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Stable URN identifying the error category. */
    public abstract String urn();

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
