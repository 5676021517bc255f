package me.christianrobert.spmodernize.rewrite.rule;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the introducing {@code CREATE PROCEDURE} (or PROC, FUNCTION, TRIGGER, VIEW) of a
 * definition into {@code ALTER ...}, so the rewritten text can be executed against the
 * routine that already exists.
 *
 * <p>Only the first CREATE/ALTER + kind pair is inspected. If it already reads ALTER,
 * nothing changes; later occurrences (e.g. inside dynamic SQL strings) are never touched.</p>
 */
public class DefinitionKeywordRule implements RewriteRule {

    public static final String NAME = "DEFINITION_CREATE_TO_ALTER";

    private static final Pattern DEFINITION_KEYWORD = Pattern.compile(
            "\\b(CREATE|ALTER)(\\s+)(PROCEDURE|PROC|FUNCTION|TRIGGER|VIEW)\\b",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String apply(String text) {
        Matcher matcher = DEFINITION_KEYWORD.matcher(text);
        if (!matcher.find() || !"CREATE".equalsIgnoreCase(matcher.group(1))) {
            return text;
        }

        return text.substring(0, matcher.start())
                + "ALTER" + matcher.group(2) + matcher.group(3)
                + text.substring(matcher.end());
    }

    /**
     * Promotes a leading plain {@code CREATE <kind>} to {@code CREATE OR ALTER <kind>}.
     * Used when a stored CREATE text has to be redeployed over an existing routine.
     */
    public static String promoteToCreateOrAlter(String text) {
        Matcher matcher = DEFINITION_KEYWORD.matcher(text);
        if (!matcher.find() || !"CREATE".equalsIgnoreCase(matcher.group(1))) {
            return text;
        }

        return text.substring(0, matcher.start())
                + "CREATE OR ALTER" + matcher.group(2) + matcher.group(3)
                + text.substring(matcher.end());
    }
}
