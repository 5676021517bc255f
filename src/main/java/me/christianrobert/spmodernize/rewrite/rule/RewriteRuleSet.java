package me.christianrobert.spmodernize.rewrite.rule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The fixed, ordered list of plain-text substitutions applied after RAISERROR conversion.
 *
 * <ol>
 *   <li>TEXT / NTEXT → NVARCHAR(MAX), IMAGE → VARBINARY(MAX) (whitespace on both sides required)</li>
 *   <li>GETDATE() → SYSDATETIME()</li>
 *   <li>{@code *=} → LEFT JOIN, {@code =*} → RIGHT JOIN</li>
 *   <li>SET ANSI_NULLS OFF / SET QUOTED_IDENTIFIER OFF → ON</li>
 *   <li>CREATE &lt;kind&gt; → ALTER &lt;kind&gt;, only when something else changed</li>
 * </ol>
 *
 * <p>No rule produces text that an earlier or later rule matches again, so running the set
 * twice gives the same result as running it once. None of the rules know about string
 * literals or comments.</p>
 */
public class RewriteRuleSet {

    private static final Logger log = LoggerFactory.getLogger(RewriteRuleSet.class);

    public static final String TEXT_TYPE = "DEPRECATED_TEXT_TYPE";
    public static final String NTEXT_TYPE = "DEPRECATED_NTEXT_TYPE";
    public static final String IMAGE_TYPE = "DEPRECATED_IMAGE_TYPE";
    public static final String GETDATE_FUNCTION = "GETDATE_TO_SYSDATETIME";
    public static final String LEFT_OUTER_JOIN_MARKER = "LEGACY_LEFT_OUTER_JOIN";
    public static final String RIGHT_OUTER_JOIN_MARKER = "LEGACY_RIGHT_OUTER_JOIN";
    public static final String ANSI_NULLS_OFF = "ANSI_NULLS_OFF";
    public static final String QUOTED_IDENTIFIER_OFF = "QUOTED_IDENTIFIER_OFF";

    private final List<RewriteRule> contentRules;
    private final RewriteRule definitionRule;

    public RewriteRuleSet() {
        this(defaultContentRules(), new DefinitionKeywordRule());
    }

    public RewriteRuleSet(List<RewriteRule> contentRules, RewriteRule definitionRule) {
        this.contentRules = List.copyOf(contentRules);
        this.definitionRule = definitionRule;
    }

    public static List<RewriteRule> defaultContentRules() {
        return List.of(
                new PatternRewriteRule(TEXT_TYPE, "(?<=\\s)TEXT(?=\\s)", "NVARCHAR(MAX)"),
                new PatternRewriteRule(NTEXT_TYPE, "(?<=\\s)NTEXT(?=\\s)", "NVARCHAR(MAX)"),
                new PatternRewriteRule(IMAGE_TYPE, "(?<=\\s)IMAGE(?=\\s)", "VARBINARY(MAX)"),
                new PatternRewriteRule(GETDATE_FUNCTION, "(?<![\\w@#$])GETDATE\\s*\\(\\s*\\)", "SYSDATETIME()"),
                new PatternRewriteRule(LEFT_OUTER_JOIN_MARKER, "\\*=", "LEFT JOIN"),
                new PatternRewriteRule(RIGHT_OUTER_JOIN_MARKER, "=\\*", "RIGHT JOIN"),
                new PatternRewriteRule(ANSI_NULLS_OFF, "\\bSET\\s+ANSI_NULLS\\s+OFF\\b", "SET ANSI_NULLS ON"),
                new PatternRewriteRule(QUOTED_IDENTIFIER_OFF, "\\bSET\\s+QUOTED_IDENTIFIER\\s+OFF\\b",
                        "SET QUOTED_IDENTIFIER ON")
        );
    }

    /**
     * Applies all content rules in order, then the definition keyword rule if the text
     * changed at all (here or in an earlier RAISERROR pass).
     *
     * @param text text after RAISERROR conversion
     * @param alreadyChanged whether the RAISERROR pass changed the text
     * @param appliedRules receives the names of the rules that changed the text
     * @return the rewritten text
     */
    public String apply(String text, boolean alreadyChanged, List<String> appliedRules) {
        String current = text;
        for (RewriteRule rule : contentRules) {
            String next = rule.apply(current);
            if (!next.equals(current)) {
                appliedRules.add(rule.getName());
                log.trace("Rule {} changed the text", rule.getName());
                current = next;
            }
        }

        boolean changed = alreadyChanged || !current.equals(text);
        if (changed) {
            String next = definitionRule.apply(current);
            if (!next.equals(current)) {
                appliedRules.add(definitionRule.getName());
                current = next;
            }
        }
        return current;
    }
}
