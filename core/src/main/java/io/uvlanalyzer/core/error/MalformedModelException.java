package io.uvlanalyzer.core.error;

/**
 * Thrown when model text is not a well-formed UVL feature model: empty input, missing or
 * duplicated root, inconsistent indentation or group structure, duplicate feature names, or a
 * constraint that references an undefined feature. URN:
 * {@code urn:uvl-analyzer:error:malformed-model}
 */
public final class MalformedModelException extends ModelLoadException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:uvl-analyzer:error:malformed-model";

    public MalformedModelException(String message, int line) {
        super(message, line);
    }

    public MalformedModelException(String message, Throwable cause, int line) {
        super(message, cause, line);
    }

    @Override
    public String urn() {
        return URN;
    }
}
