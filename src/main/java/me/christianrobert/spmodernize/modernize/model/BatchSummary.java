package me.christianrobert.spmodernize.modernize.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a batch run. Tracks per-unit outcomes and failures, keyed by {@code schema.name}.
 * A unit counts as succeeded when it did not fail, whether or not it was changed.
 */
public class BatchSummary {
    private Map<String, UnitApplyResult> unitResults;
    private Map<String, ErrorInfo> errors;
    private int totalUnits;
    private int processedCount;
    private int succeededCount;
    private int appliedCount;
    private int previewedCount;
    private int unchangedCount;
    private int failedCount;

    public BatchSummary() {
        this.unitResults = new LinkedHashMap<>();
        this.errors = new LinkedHashMap<>();
    }

    public BatchSummary(int totalUnits) {
        this();
        this.totalUnits = totalUnits;
    }

    public void addUnitResult(UnitApplyResult result) {
        String key = result.getUnit().toString();
        unitResults.put(key, result);
        processedCount++;

        switch (result.getOutcome()) {
            case APPLIED:
                appliedCount++;
                succeededCount++;
                break;
            case PREVIEWED:
                previewedCount++;
                succeededCount++;
                break;
            case UNCHANGED:
                unchangedCount++;
                succeededCount++;
                break;
            case FAILED:
                failedCount++;
                errors.put(key, new ErrorInfo(key, result.getErrorMessage(), result.getBackupId()));
                break;
            default:
                throw new IllegalArgumentException("Unknown outcome: " + result.getOutcome());
        }
    }

    public Map<String, UnitApplyResult> getUnitResults() {
        return unitResults;
    }

    public Map<String, ErrorInfo> getErrors() {
        return errors;
    }

    public int getTotalUnits() {
        return totalUnits;
    }

    public int getProcessedCount() {
        return processedCount;
    }

    public int getSucceededCount() {
        return succeededCount;
    }

    /** Units that were (or in preview mode, would be) changed. */
    public int getChangedCount() {
        return appliedCount + previewedCount;
    }

    public int getAppliedCount() {
        return appliedCount;
    }

    public int getPreviewedCount() {
        return previewedCount;
    }

    public int getUnchangedCount() {
        return unchangedCount;
    }

    public int getFailedCount() {
        return failedCount;
    }

    public boolean isSuccessful() {
        return failedCount == 0;
    }

    /**
     * Error information for a unit that could not be modernized.
     */
    public static class ErrorInfo {
        private String unitName;
        private String error;
        private Long backupId;

        public ErrorInfo(String unitName, String error, Long backupId) {
            this.unitName = unitName;
            this.error = error;
            this.backupId = backupId;
        }

        public String getUnitName() {
            return unitName;
        }

        public String getError() {
            return error;
        }

        /** Backup left in BACKED_UP when the commit failed; null otherwise. */
        public Long getBackupId() {
            return backupId;
        }
    }

    @Override
    public String toString() {
        return String.format("BatchSummary{processed=%d/%d, succeeded=%d, changed=%d, unchanged=%d, failed=%d}",
                processedCount, totalUnits, succeededCount, getChangedCount(), unchangedCount, failedCount);
    }
}
