package io.uvlanalyzer.core.error;

/**
 * Thrown when a cross-tree constraint cannot be parsed. A specialisation of the malformed-model
 * condition that also knows the column of the offending token. URN:
 * {@code urn:uvl-analyzer:error:malformed-model}
 */
public final class ConstraintSyntaxException extends ModelLoadException {

    private static final long serialVersionUID = 1L;

    private final int column;

    public ConstraintSyntaxException(String message, int line, int column) {
        super(message, line);
        this.column = column;
    }

    /** The 1-based column within the constraint line. */
    public int column() {
        return column;
    }

    @Override
    public String location() {
        return super.location() + ", column " + column;
    }

    @Override
    public String urn() {
        return MalformedModelException.URN;
    }
}
