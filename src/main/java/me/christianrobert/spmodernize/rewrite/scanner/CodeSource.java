package me.christianrobert.spmodernize.rewrite.scanner;

/**
 * Where the error number of a converted statement comes from: a numeric literal,
 * or a reference (variable, string literal or expression) that is carried through verbatim.
 */
public class CodeSource {

    public enum Kind {
        LITERAL,
        REFERENCE
    }

    private final Kind kind;
    private final int literalValue;
    private final String expression;

    private CodeSource(Kind kind, int literalValue, String expression) {
        this.kind = kind;
        this.literalValue = literalValue;
        this.expression = expression;
    }

    public static CodeSource literal(int value, String token) {
        return new CodeSource(Kind.LITERAL, value, token);
    }

    public static CodeSource reference(String expression) {
        return new CodeSource(Kind.REFERENCE, 0, expression);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    public boolean isReference() {
        return kind == Kind.REFERENCE;
    }

    /** Literal value as written, before the custom-error floor is applied. */
    public int getLiteralValue() {
        return literalValue;
    }

    /** Original token text. */
    public String getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return isLiteral() ? "Literal(" + literalValue + ")" : "Reference(" + expression + ")";
    }
}
