package io.uvlanalyzer.core.error;

/**
 * Thrown when the extra parameter of an operation (selection list, filter criteria, sample
 * count) is missing or cannot be parsed. URN: {@code urn:uvl-analyzer:error:invalid-argument}
 */
public final class InvalidArgumentException extends AnalysisEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:uvl-analyzer:error:invalid-argument";

    public InvalidArgumentException(String message, String operation) {
        super(message, operation);
    }

    public InvalidArgumentException(String message, Throwable cause, String operation) {
        super(message, cause, operation);
    }

    @Override
    public String urn() {
        return URN;
    }
}
