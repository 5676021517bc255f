package me.christianrobert.spmodernize.analysis;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Counts deprecated constructs in procedure text for preview output.
 * Purely textual, like the rewrite itself: matches inside comments and string literals are counted too.
 */
@ApplicationScoped
public class DeprecatedSyntaxDetector {

    private static final Logger log = LoggerFactory.getLogger(DeprecatedSyntaxDetector.class);

    public List<SyntaxIssue> detect(String text) {
        List<SyntaxIssue> issues = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return issues;
        }

        for (LegacySignatures.Signature signature : LegacySignatures.ALL) {
            int count = signature.countIn(text);
            if (count > 0) {
                issues.add(new SyntaxIssue(signature.getCategory(), signature.getConstruct(),
                        signature.getRecommendation(), count));
            }
        }

        log.debug("Detected {} deprecated construct kinds", issues.size());
        return issues;
    }

    /**
     * @return distinct categories in declaration order of the signatures
     */
    public List<IssueCategory> categoriesOf(List<SyntaxIssue> issues) {
        Set<IssueCategory> categories = new LinkedHashSet<>();
        for (SyntaxIssue issue : issues) {
            categories.add(issue.getCategory());
        }
        return new ArrayList<>(categories);
    }

    /**
     * Human-readable one-line summary, e.g. {@code "Error Handling, Data Types"}.
     */
    public String summarize(List<SyntaxIssue> issues) {
        List<IssueCategory> categories = categoriesOf(issues);
        if (categories.isEmpty()) {
            return "No deprecated syntax found";
        }
        List<String> names = new ArrayList<>();
        for (IssueCategory category : categories) {
            names.add(category.getDisplayName());
        }
        return String.join(", ", names);
    }
}
