package me.christianrobert.spmodernize.rewrite.scanner;

/**
 * Transient view of one RAISERROR occurrence bounded by the {@link StatementScanner}.
 * Never persisted.
 */
public class ParsedLegacyStatement {

    public enum Form {
        /** {@code RAISERROR (code, severity, state, message)} */
        PARENTHESIZED,
        /** {@code RAISERROR 50001 @msg} - the pre-2005 form, bounded by the line end */
        UNPARENTHESIZED
    }

    private final String rawText;
    private final Form form;
    private final String paramListText;
    private final String codeToken;
    private final String messageText;

    private ParsedLegacyStatement(String rawText, Form form, String paramListText,
                                  String codeToken, String messageText) {
        this.rawText = rawText;
        this.form = form;
        this.paramListText = paramListText;
        this.codeToken = codeToken;
        this.messageText = messageText;
    }

    public static ParsedLegacyStatement parenthesized(String rawText, String paramListText) {
        return new ParsedLegacyStatement(rawText, Form.PARENTHESIZED, paramListText, null, null);
    }

    public static ParsedLegacyStatement unparenthesized(String rawText, String codeToken, String messageText) {
        return new ParsedLegacyStatement(rawText, Form.UNPARENTHESIZED, codeToken + " " + messageText,
                codeToken, messageText);
    }

    public String getRawText() {
        return rawText;
    }

    public Form getForm() {
        return form;
    }

    /**
     * Text between the outer parentheses for the parenthesized form,
     * or "code message" for the unparenthesized form.
     */
    public String getParamListText() {
        return paramListText;
    }

    /** Only set for the unparenthesized form. */
    public String getCodeToken() {
        return codeToken;
    }

    /** Only set for the unparenthesized form. */
    public String getMessageText() {
        return messageText;
    }

    public boolean isParenthesized() {
        return form == Form.PARENTHESIZED;
    }

    @Override
    public String toString() {
        return "ParsedLegacyStatement{form=" + form + ", rawText='" + rawText + "'}";
    }
}
