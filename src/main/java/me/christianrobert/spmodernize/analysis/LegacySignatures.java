package me.christianrobert.spmodernize.analysis;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Patterns of the deprecated constructs the modernizer knows about.
 * Used to pre-filter catalog units and to count occurrences for preview.
 */
public final class LegacySignatures {

    public static final class Signature {
        private final IssueCategory category;
        private final String construct;
        private final String recommendation;
        private final Pattern pattern;

        Signature(IssueCategory category, String construct, String recommendation, String regex) {
            this.category = category;
            this.construct = construct;
            this.recommendation = recommendation;
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        }

        public IssueCategory getCategory() {
            return category;
        }

        public String getConstruct() {
            return construct;
        }

        public String getRecommendation() {
            return recommendation;
        }

        public Pattern getPattern() {
            return pattern;
        }

        public int countIn(String text) {
            Matcher matcher = pattern.matcher(text);
            int count = 0;
            while (matcher.find()) {
                count++;
            }
            return count;
        }
    }

    public static final List<Signature> ALL = List.of(
            new Signature(IssueCategory.ERROR_HANDLING, "RAISERROR", "Use THROW",
                    "(?<![\\w@#$])RAISERROR(?![\\w@#$])"),
            new Signature(IssueCategory.DATA_TYPES, "TEXT", "Use NVARCHAR(MAX)", "(?<=\\s)TEXT(?=\\s)"),
            new Signature(IssueCategory.DATA_TYPES, "NTEXT", "Use NVARCHAR(MAX)", "(?<=\\s)NTEXT(?=\\s)"),
            new Signature(IssueCategory.DATA_TYPES, "IMAGE", "Use VARBINARY(MAX)", "(?<=\\s)IMAGE(?=\\s)"),
            new Signature(IssueCategory.JOIN_SYNTAX, "*=", "Use LEFT OUTER JOIN", "\\*="),
            new Signature(IssueCategory.JOIN_SYNTAX, "=*", "Use RIGHT OUTER JOIN", "=\\*"),
            new Signature(IssueCategory.SETTINGS, "SET ANSI_NULLS OFF", "Use SET ANSI_NULLS ON",
                    "\\bSET\\s+ANSI_NULLS\\s+OFF\\b"),
            new Signature(IssueCategory.SETTINGS, "SET QUOTED_IDENTIFIER OFF", "Use SET QUOTED_IDENTIFIER ON",
                    "\\bSET\\s+QUOTED_IDENTIFIER\\s+OFF\\b"),
            new Signature(IssueCategory.FUNCTIONS, "GETDATE()", "Use SYSDATETIME()",
                    "(?<![\\w@#$])GETDATE\\s*\\(\\s*\\)")
    );

    private LegacySignatures() {
    }

    /**
     * @return true if the text contains at least one known deprecated construct
     */
    public static boolean matchesAny(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (Signature signature : ALL) {
            if (signature.getPattern().matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
