package me.christianrobert.spmodernize.rewrite.rule;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces every match of a pattern with a fixed replacement.
 * The replacement is inserted literally ({@code $} and {@code \} have no special meaning).
 */
public class PatternRewriteRule implements RewriteRule {

    private final String name;
    private final Pattern pattern;
    private final String replacement;

    public PatternRewriteRule(String name, Pattern pattern, String replacement) {
        this.name = name;
        this.pattern = pattern;
        this.replacement = Matcher.quoteReplacement(replacement);
    }

    public PatternRewriteRule(String name, String regex, String replacement) {
        this(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String apply(String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        return matcher.replaceAll(replacement);
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }

    @Override
    public String toString() {
        return "PatternRewriteRule{" + name + ": " + pattern.pattern() + "}";
    }
}
