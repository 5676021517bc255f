package me.christianrobert.spmodernize.modernize.model;

import me.christianrobert.spmodernize.analysis.SyntaxIssue;
import me.christianrobert.spmodernize.core.model.UnitIdentity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Preview of one unit: what was detected and whether a rewrite would change it.
 */
public class PreviewEntry {

    private final UnitIdentity unit;
    private final List<SyntaxIssue> issues;
    private final String issueSummary;
    private final boolean wouldChange;
    private final int convertibleStatements;
    private final List<String> reviewNotes;

    public PreviewEntry(UnitIdentity unit, List<SyntaxIssue> issues, String issueSummary, boolean wouldChange,
                        int convertibleStatements, List<String> reviewNotes) {
        this.unit = unit;
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
        this.issueSummary = issueSummary;
        this.wouldChange = wouldChange;
        this.convertibleStatements = convertibleStatements;
        this.reviewNotes = Collections.unmodifiableList(new ArrayList<>(reviewNotes));
    }

    public UnitIdentity getUnit() {
        return unit;
    }

    public List<SyntaxIssue> getIssues() {
        return issues;
    }

    public String getIssueSummary() {
        return issueSummary;
    }

    public boolean isWouldChange() {
        return wouldChange;
    }

    public int getConvertibleStatements() {
        return convertibleStatements;
    }

    public List<String> getReviewNotes() {
        return reviewNotes;
    }
}
