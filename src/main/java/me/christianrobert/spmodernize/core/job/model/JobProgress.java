package me.christianrobert.spmodernize.core.job.model;

import java.time.LocalDateTime;

/**
 * Snapshot of a running job. Unit counters are only set by jobs that work through a list of units.
 */
public class JobProgress {
    private int percentage;
    private String currentTask;
    private String details;
    private LocalDateTime lastUpdated;
    private Integer processedUnits;
    private Integer totalUnits;

    public JobProgress() {
        this.percentage = 0;
        this.currentTask = "";
        this.details = "";
        this.lastUpdated = LocalDateTime.now();
    }

    public JobProgress(int percentage, String currentTask) {
        this();
        this.percentage = Math.max(0, Math.min(100, percentage));
        this.currentTask = currentTask != null ? currentTask : "";
    }

    public JobProgress(int percentage, String currentTask, String details) {
        this(percentage, currentTask);
        this.details = details != null ? details : "";
    }

    /**
     * Progress through a list of units. {@code maxPercentage} caps the value so the
     * job can still report its own finishing steps afterwards.
     */
    public static JobProgress forUnits(int processed, int total, int maxPercentage, String currentTask, String details) {
        int percentage = total == 0 ? maxPercentage : (int) ((long) processed * maxPercentage / total);
        JobProgress progress = new JobProgress(percentage, currentTask, details);
        progress.processedUnits = processed;
        progress.totalUnits = total;
        return progress;
    }

    public int getPercentage() {
        return percentage;
    }

    public String getCurrentTask() {
        return currentTask;
    }

    public String getDetails() {
        return details;
    }

    public LocalDateTime getLastUpdated() {
        return lastUpdated;
    }

    public Integer getProcessedUnits() {
        return processedUnits;
    }

    public Integer getTotalUnits() {
        return totalUnits;
    }

    @Override
    public String toString() {
        return "JobProgress{" +
                "percentage=" + percentage +
                ", currentTask='" + currentTask + '\'' +
                ", details='" + details + '\'' +
                (totalUnits != null ? ", units=" + processedUnits + "/" + totalUnits : "") +
                ", lastUpdated=" + lastUpdated +
                '}';
    }
}
