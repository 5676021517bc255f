package me.christianrobert.spmodernize.modernize.model;

import me.christianrobert.spmodernize.core.model.UnitIdentity;

import java.time.LocalDateTime;

public class RollbackResult {

    private final UnitIdentity unit;
    private final long backupId;
    private final LocalDateTime backupCreatedAt;
    private final LocalDateTime rolledBackAt;

    public RollbackResult(UnitIdentity unit, long backupId, LocalDateTime backupCreatedAt) {
        this.unit = unit;
        this.backupId = backupId;
        this.backupCreatedAt = backupCreatedAt;
        this.rolledBackAt = LocalDateTime.now();
    }

    public UnitIdentity getUnit() {
        return unit;
    }

    public long getBackupId() {
        return backupId;
    }

    public LocalDateTime getBackupCreatedAt() {
        return backupCreatedAt;
    }

    public LocalDateTime getRolledBackAt() {
        return rolledBackAt;
    }
}
