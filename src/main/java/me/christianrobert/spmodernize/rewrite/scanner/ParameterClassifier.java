package me.christianrobert.spmodernize.rewrite.scanner;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns a RAISERROR parameter list into THROW arguments.
 *
 * <p>Parameter positions are read as {@code (code, severity, state, message)}:</p>
 * <ul>
 *   <li>A numeric first parameter is the error number. Numbers below 50000 are raised to 50000,
 *       the lowest number THROW accepts for user errors. The message is the fourth parameter,
 *       or {@value #DEFAULT_MESSAGE} when there is none.</li>
 *   <li>Any other first parameter (variable, string literal, expression) becomes the message
 *       and the error number is 50000.</li>
 *   <li>State is the third parameter, or 1 if missing or not numeric.</li>
 *   <li>Severity has no place in THROW and is dropped. Callers filtering on severity downstream
 *       must be told; see {@link ClassifiedParameters#getDroppedSeverity()}.</li>
 * </ul>
 *
 * <p>The comma split is depth-aware for parentheses only. A comma inside a string literal
 * splits the list.</p>
 */
public class ParameterClassifier {

    public static final int MIN_CUSTOM_ERROR_NUMBER = 50000;
    public static final String DEFAULT_MESSAGE = "'An error occurred'";
    public static final int DEFAULT_STATE = 1;

    private static final Pattern INTEGER_LITERAL = Pattern.compile("[+-]?\\d+");

    /**
     * Classifies the text between the parentheses of a parenthesized RAISERROR.
     */
    public ClassifiedParameters classify(String paramListText) {
        List<String> tokens = splitTopLevel(paramListText);
        String first = tokens.isEmpty() ? "" : tokens.get(0);

        CodeSource codeSource = classifyCode(first);
        String severity = tokens.size() > 1 ? tokens.get(1) : null;
        int state = parseState(tokens.size() > 2 ? tokens.get(2) : null);

        if (codeSource.isLiteral()) {
            String message = tokens.size() > 3 ? tokens.get(3) : DEFAULT_MESSAGE;
            return new ClassifiedParameters(codeSource, applyFloor(codeSource.getLiteralValue()),
                    message, state, severity);
        }

        return new ClassifiedParameters(codeSource, MIN_CUSTOM_ERROR_NUMBER, first, state, severity);
    }

    /**
     * Classifies the unparenthesized form. That form has no severity, so state is always 1.
     */
    public ClassifiedParameters classifyUnparenthesized(String codeToken, String messageText) {
        CodeSource codeSource = classifyCode(codeToken);
        int errorNumber = codeSource.isLiteral()
                ? applyFloor(codeSource.getLiteralValue())
                : MIN_CUSTOM_ERROR_NUMBER;
        return new ClassifiedParameters(codeSource, errorNumber,
                messageText, DEFAULT_STATE, null);
    }

    public ClassifiedParameters classify(ParsedLegacyStatement statement) {
        if (statement.isParenthesized()) {
            return classify(statement.getParamListText());
        }
        return classifyUnparenthesized(statement.getCodeToken(), statement.getMessageText());
    }

    /**
     * Splits on commas that are not nested in parentheses. Tokens are trimmed.
     */
    public List<String> splitTopLevel(String paramListText) {
        List<String> tokens = new ArrayList<>();
        if (paramListText == null || paramListText.trim().isEmpty()) {
            return tokens;
        }

        int depth = 0;
        int tokenStart = 0;
        for (int i = 0; i < paramListText.length(); i++) {
            char c = paramListText.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                tokens.add(paramListText.substring(tokenStart, i).trim());
                tokenStart = i + 1;
            }
        }
        tokens.add(paramListText.substring(tokenStart).trim());
        return tokens;
    }

    CodeSource classifyCode(String token) {
        if (token != null && INTEGER_LITERAL.matcher(token).matches()) {
            try {
                return CodeSource.literal(Integer.parseInt(token), token);
            } catch (NumberFormatException e) {
                // Out of int range: THROW cannot take it as a number either
                return CodeSource.reference(token);
            }
        }
        return CodeSource.reference(token);
    }

    static int applyFloor(int errorNumber) {
        return Math.max(errorNumber, MIN_CUSTOM_ERROR_NUMBER);
    }

    private static int parseState(String token) {
        if (token == null || !INTEGER_LITERAL.matcher(token).matches()) {
            return DEFAULT_STATE;
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            return DEFAULT_STATE;
        }
    }
}
