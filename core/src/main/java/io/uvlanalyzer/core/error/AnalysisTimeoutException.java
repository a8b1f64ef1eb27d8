package io.uvlanalyzer.core.error;

/**
 * Thrown when a solving, counting or enumeration step exceeds its deadline or is cancelled.
 * No partial result accompanies this exception. URN: {@code urn:uvl-analyzer:error:timeout}
 */
public final class AnalysisTimeoutException extends AnalysisEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:uvl-analyzer:error:timeout";

    private final long budgetMs;

    public AnalysisTimeoutException(String message, long budgetMs, String operation) {
        super(message, operation);
        this.budgetMs = budgetMs;
    }

    public AnalysisTimeoutException(String message, Throwable cause, long budgetMs, String operation) {
        super(message, cause, operation);
        this.budgetMs = budgetMs;
    }

    /** The budget that was exceeded, in milliseconds. */
    public long budgetMs() {
        return budgetMs;
    }

    @Override
    public String urn() {
        return URN;
    }
}
