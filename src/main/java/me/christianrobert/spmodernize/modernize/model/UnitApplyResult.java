package me.christianrobert.spmodernize.modernize.model;

import me.christianrobert.spmodernize.core.model.UnitIdentity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What happened to one unit during an apply.
 */
public class UnitApplyResult {

    private final UnitIdentity unit;
    private final ApplyOutcome outcome;
    private final Long backupId;
    private final int convertedStatements;
    private final List<String> appliedRules;
    private final List<String> reviewNotes;
    private final String errorMessage;

    public UnitApplyResult(UnitIdentity unit, ApplyOutcome outcome, Long backupId, int convertedStatements,
                           List<String> appliedRules, List<String> reviewNotes, String errorMessage) {
        this.unit = unit;
        this.outcome = outcome;
        this.backupId = backupId;
        this.convertedStatements = convertedStatements;
        this.appliedRules = Collections.unmodifiableList(new ArrayList<>(appliedRules));
        this.reviewNotes = Collections.unmodifiableList(new ArrayList<>(reviewNotes));
        this.errorMessage = errorMessage;
    }

    public static UnitApplyResult unchanged(UnitIdentity unit) {
        return new UnitApplyResult(unit, ApplyOutcome.UNCHANGED, null, 0, List.of(), List.of(), null);
    }

    public UnitIdentity getUnit() {
        return unit;
    }

    public ApplyOutcome getOutcome() {
        return outcome;
    }

    /** Journal record id, or null when no backup was written. */
    public Long getBackupId() {
        return backupId;
    }

    public int getConvertedStatements() {
        return convertedStatements;
    }

    public List<String> getAppliedRules() {
        return appliedRules;
    }

    public List<String> getReviewNotes() {
        return reviewNotes;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean isChanged() {
        return outcome == ApplyOutcome.PREVIEWED || outcome == ApplyOutcome.APPLIED;
    }

    @Override
    public String toString() {
        return "UnitApplyResult{unit=" + unit + ", outcome=" + outcome + ", backupId=" + backupId + "}";
    }
}
