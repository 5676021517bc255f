package me.christianrobert.spmodernize.core.event;

import me.christianrobert.spmodernize.modernize.model.BatchSummary;

import java.time.LocalDateTime;

/**
 * Fired when a batch modernization job has finished processing its units.
 */
public class ModernizationCompletedEvent {

    private final String jobId;
    private final boolean previewOnly;
    private final BatchSummary summary;
    private final LocalDateTime timestamp;

    public ModernizationCompletedEvent(String jobId, boolean previewOnly, BatchSummary summary) {
        this.jobId = jobId;
        this.previewOnly = previewOnly;
        this.summary = summary;
        this.timestamp = LocalDateTime.now();
    }

    public String getJobId() {
        return jobId;
    }

    public boolean isPreviewOnly() {
        return previewOnly;
    }

    public BatchSummary getSummary() {
        return summary;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return String.format("ModernizationCompletedEvent{jobId='%s', previewOnly=%s, processed=%d, failed=%d, timestamp=%s}",
                jobId, previewOnly, summary.getProcessedCount(), summary.getFailedCount(), timestamp);
    }
}
