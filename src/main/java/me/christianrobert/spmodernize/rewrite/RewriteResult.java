package me.christianrobert.spmodernize.rewrite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Detailed outcome of one {@link RewriteEngine#rewriteWithReport(String)} call.
 */
public class RewriteResult {

    private final String originalText;
    private final String rewrittenText;
    private final int convertedStatements;
    private final List<String> skippedOccurrences;
    private final List<String> appliedRules;
    private final List<String> reviewNotes;

    public RewriteResult(String originalText, String rewrittenText, int convertedStatements,
                         List<String> skippedOccurrences, List<String> appliedRules, List<String> reviewNotes) {
        this.originalText = originalText;
        this.rewrittenText = rewrittenText;
        this.convertedStatements = convertedStatements;
        this.skippedOccurrences = Collections.unmodifiableList(new ArrayList<>(skippedOccurrences));
        this.appliedRules = Collections.unmodifiableList(new ArrayList<>(appliedRules));
        this.reviewNotes = Collections.unmodifiableList(new ArrayList<>(reviewNotes));
    }

    public String getOriginalText() {
        return originalText;
    }

    public String getRewrittenText() {
        return rewrittenText;
    }

    public boolean isChanged() {
        return !originalText.equals(rewrittenText);
    }

    /** Number of RAISERROR statements replaced by THROW. */
    public int getConvertedStatements() {
        return convertedStatements;
    }

    /** RAISERROR occurrences left untouched, with the reason. */
    public List<String> getSkippedOccurrences() {
        return skippedOccurrences;
    }

    /** Names of the substitution rules that changed the text, in application order. */
    public List<String> getAppliedRules() {
        return appliedRules;
    }

    /** Places where the output should be checked by a person before it is deployed. */
    public List<String> getReviewNotes() {
        return reviewNotes;
    }

    public boolean needsManualReview() {
        return !reviewNotes.isEmpty();
    }

    @Override
    public String toString() {
        return "RewriteResult{changed=" + isChanged() + ", converted=" + convertedStatements
                + ", skipped=" + skippedOccurrences.size() + ", rules=" + appliedRules
                + ", reviewNotes=" + reviewNotes.size() + "}";
    }
}
