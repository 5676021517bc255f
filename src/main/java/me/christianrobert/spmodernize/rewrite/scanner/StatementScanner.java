package me.christianrobert.spmodernize.rewrite.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keyword-anchored scanner that bounds RAISERROR statements in procedure source.
 *
 * Two shapes are recognized:
 * <ul>
 *   <li>Parenthesized: {@code RAISERROR (...)}. The end is found by tracking parenthesis depth,
 *       so nested expressions such as {@code CAST(@id AS NVARCHAR(20))} stay inside the statement.</li>
 *   <li>Unparenthesized: {@code RAISERROR 50001 @msg}. The statement runs to the end of the line.</li>
 * </ul>
 *
 * **IMPORTANT:** String literals and comments are not recognized. A parenthesis inside
 * {@code 'text (like this'} counts toward the depth. Anything that cannot be bounded is
 * reported as {@link ScanResult.Kind#AMBIGUOUS} and left for manual review.
 */
public class StatementScanner {

    private static final Logger log = LoggerFactory.getLogger(StatementScanner.class);

    public static final String KEYWORD = "RAISERROR";

    /**
     * Finds the next RAISERROR occurrence at or after {@code fromOffset}.
     *
     * @param text procedure source
     * @param fromOffset offset to start searching from
     * @return FOUND with the statement span, AMBIGUOUS if the occurrence could not be bounded,
     *         NOT_FOUND if no occurrence remains
     */
    public ScanResult locateLegacyStatement(String text, int fromOffset) {
        if (text == null || fromOffset >= text.length()) {
            return ScanResult.notFound();
        }

        int keywordStart = findKeyword(text, Math.max(0, fromOffset));
        if (keywordStart == -1) {
            return ScanResult.notFound();
        }

        int afterKeyword = keywordStart + KEYWORD.length();
        int cursor = skipWhitespace(text, afterKeyword);

        if (cursor < text.length() && text.charAt(cursor) == '(') {
            return scanParenthesized(text, keywordStart, cursor);
        }

        if (cursor > afterKeyword && cursor < text.length()
                && Character.isDigit(text.charAt(cursor))
                && !containsLineTerminator(text, afterKeyword, cursor)) {
            return scanUnparenthesized(text, keywordStart, cursor);
        }

        log.debug("RAISERROR at offset {} is neither parenthesized nor followed by an error number", keywordStart);
        return ScanResult.ambiguous(keywordStart, afterKeyword, "unsupported RAISERROR form");
    }

    private ScanResult scanParenthesized(String text, int keywordStart, int openParen) {
        int depth = 0;
        for (int i = openParen; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    String paramListText = text.substring(openParen + 1, i);
                    String trimmed = paramListText.trim();
                    if (trimmed.isEmpty() || trimmed.startsWith(",")) {
                        return ScanResult.ambiguous(keywordStart, keywordStart + KEYWORD.length(),
                                "empty first parameter");
                    }
                    String raw = text.substring(keywordStart, i + 1);
                    log.trace("Bounded parenthesized RAISERROR at {}..{}: {}", keywordStart, i + 1, raw);
                    return ScanResult.found(keywordStart, i + 1,
                            ParsedLegacyStatement.parenthesized(raw, paramListText));
                }
            }
        }

        log.debug("No matching close parenthesis for RAISERROR at offset {}", keywordStart);
        return ScanResult.ambiguous(keywordStart, keywordStart + KEYWORD.length(), "unbalanced parentheses");
    }

    private ScanResult scanUnparenthesized(String text, int keywordStart, int codeStart) {
        int lineEnd = findLineEnd(text, keywordStart);

        // Statement span excludes trailing whitespace and a terminating semicolon
        int statementEnd = trimTrailingWhitespace(text, codeStart, lineEnd);
        if (statementEnd > codeStart && text.charAt(statementEnd - 1) == ';') {
            statementEnd = trimTrailingWhitespace(text, codeStart, statementEnd - 1);
        }

        String params = text.substring(codeStart, statementEnd);
        int split = indexOfWhitespace(params);
        if (split == -1) {
            return ScanResult.ambiguous(keywordStart, keywordStart + KEYWORD.length(),
                    "no message after error number");
        }

        String codeToken = params.substring(0, split);
        String messageText = params.substring(split).trim();
        if (messageText.isEmpty()) {
            return ScanResult.ambiguous(keywordStart, keywordStart + KEYWORD.length(),
                    "no message after error number");
        }
        if (!isAllDigits(codeToken)) {
            return ScanResult.ambiguous(keywordStart, keywordStart + KEYWORD.length(),
                    "error number is not numeric: " + codeToken);
        }

        String raw = text.substring(keywordStart, statementEnd);
        log.trace("Bounded unparenthesized RAISERROR at {}..{}: {}", keywordStart, statementEnd, raw);
        return ScanResult.found(keywordStart, statementEnd,
                ParsedLegacyStatement.unparenthesized(raw, codeToken, messageText));
    }

    private int findKeyword(String text, int fromOffset) {
        int last = text.length() - KEYWORD.length();
        for (int pos = fromOffset; pos <= last; pos++) {
            if (isKeywordAt(text, pos)) {
                return pos;
            }
        }
        return -1;
    }

    private boolean isKeywordAt(String text, int pos) {
        if (!text.regionMatches(true, pos, KEYWORD, 0, KEYWORD.length())) {
            return false;
        }

        if (pos > 0 && isIdentifierChar(text.charAt(pos - 1))) {
            return false;
        }

        int after = pos + KEYWORD.length();
        return after >= text.length() || !isIdentifierChar(text.charAt(after));
    }

    static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#' || c == '@';
    }

    private static int skipWhitespace(String text, int pos) {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static boolean containsLineTerminator(String text, int from, int to) {
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (c == '\r' || c == '\n') {
                return true;
            }
        }
        return false;
    }

    private static int findLineEnd(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r' || c == '\n') {
                return i;
            }
        }
        return text.length();
    }

    private static int trimTrailingWhitespace(String text, int lowerBound, int end) {
        while (end > lowerBound && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return end;
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isAllDigits(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
