package me.christianrobert.spmodernize.journal;

import me.christianrobert.spmodernize.core.model.UnitIdentity;

import java.time.LocalDateTime;

/**
 * One journal entry: the text of a unit before and after modernization.
 * Immutable; a status change yields a new instance with the same id.
 */
public class BackupRecord {

    private final long id;
    private final UnitIdentity unit;
    private final String originalText;
    private final String rewrittenText;
    private final LocalDateTime createdAt;
    private final BackupStatus status;

    public BackupRecord(long id, UnitIdentity unit, String originalText, String rewrittenText,
                        LocalDateTime createdAt, BackupStatus status) {
        this.id = id;
        this.unit = unit;
        this.originalText = originalText;
        this.rewrittenText = rewrittenText;
        this.createdAt = createdAt;
        this.status = status;
    }

    public BackupRecord withStatus(BackupStatus newStatus) {
        if (!status.canTransitionTo(newStatus)) {
            throw new IllegalStateException(String.format(
                    "Backup record %d cannot move from %s to %s", id, status, newStatus));
        }
        return new BackupRecord(id, unit, originalText, rewrittenText, createdAt, newStatus);
    }

    public long getId() {
        return id;
    }

    public UnitIdentity getUnit() {
        return unit;
    }

    public String getSchemaName() {
        return unit.getSchema();
    }

    public String getProcedureName() {
        return unit.getName();
    }

    public String getOriginalText() {
        return originalText;
    }

    /** May be null. */
    public String getRewrittenText() {
        return rewrittenText;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public BackupStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "BackupRecord{id=" + id + ", unit=" + unit + ", status=" + status + ", createdAt=" + createdAt + "}";
    }
}
