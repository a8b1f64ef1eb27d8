package io.uvlanalyzer.core.error;

/**
 * Abstract parent for parse-time model errors. Thrown by {@code UvlParser.parse()} and
 * therefore by every engine operation that receives model text. Carries the 1-based line of the
 * offending input so that callers can point at it; {@code 0} means the whole input (for example
 * an empty model).
 */
public abstract class ModelLoadException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final int line;

    protected ModelLoadException(String message, int line) {
        super(message, Phase.PARSE);
        this.line = line;
    }

    protected ModelLoadException(String message, Throwable cause, int line) {
        super(message, cause, Phase.PARSE);
        this.line = line;
    }

    /** The 1-based source line, or {@code 0} if the error concerns the whole input. */
    public int line() {
        return line;
    }

    /** Location hint suitable for error output, e.g. {@code "line 7"}. */
    public String location() {
        return line > 0 ? "line " + line : "input";
    }
}
