package me.christianrobert.spmodernize.rewrite.scanner;

/**
 * Outcome of {@link ParameterClassifier}: the values that go into the THROW statement.
 * The severity token is kept only so callers can be told that it was dropped.
 */
public class ClassifiedParameters {

    private final CodeSource codeSource;
    private final int errorNumber;
    private final String message;
    private final int state;
    private final String droppedSeverity;

    public ClassifiedParameters(CodeSource codeSource, int errorNumber,
                                String message, int state, String droppedSeverity) {
        this.codeSource = codeSource;
        this.errorNumber = errorNumber;
        this.message = message;
        this.state = state;
        this.droppedSeverity = droppedSeverity;
    }

    public CodeSource getCodeSource() {
        return codeSource;
    }

    /** Error number after the custom-error floor has been applied. */
    public int getErrorNumber() {
        return errorNumber;
    }

    public String getMessage() {
        return message;
    }

    public int getState() {
        return state;
    }

    /**
     * @return the severity token that THROW cannot carry, or null if none was given
     */
    public String getDroppedSeverity() {
        return droppedSeverity;
    }

    /**
     * @param terminated whether the preceding statement already ends with a semicolon,
     *                   in which case the leading {@code ;} is left out
     */
    public String toThrowStatement(boolean terminated) {
        return (terminated ? "" : ";") + "THROW " + errorNumber + ", " + message + ", " + state;
    }

    @Override
    public String toString() {
        return "ClassifiedParameters{code=" + codeSource + ", errorNumber=" + errorNumber
                + ", message='" + message + "', state=" + state + "}";
    }
}
