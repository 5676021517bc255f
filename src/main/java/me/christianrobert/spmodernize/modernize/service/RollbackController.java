package me.christianrobert.spmodernize.modernize.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.spmodernize.catalog.DefinitionStore;
import me.christianrobert.spmodernize.core.model.UnitIdentity;
import me.christianrobert.spmodernize.journal.BackupJournal;
import me.christianrobert.spmodernize.journal.BackupRecord;
import me.christianrobert.spmodernize.journal.BackupStatus;
import me.christianrobert.spmodernize.modernize.model.RollbackNotFoundException;
import me.christianrobert.spmodernize.modernize.model.RollbackResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Restores the original text of a unit from the journal.
 *
 * <p>Only UPDATED records can be rolled back. Without an explicit backup id the most recent
 * UPDATED record of the unit is used. An edit made to the unit after that record was
 * committed is overwritten without warning.</p>
 */
@ApplicationScoped
public class RollbackController {

    private static final Logger log = LoggerFactory.getLogger(RollbackController.class);

    @Inject
    BackupJournal journal;

    @Inject
    DefinitionStore definitionStore;

    /**
     * @param backupId specific record to restore, or null for the most recent UPDATED one
     * @throws RollbackNotFoundException if there is no matching UPDATED record
     * @throws me.christianrobert.spmodernize.catalog.CommitException if restoring fails; the record keeps its status
     */
    public RollbackResult rollback(UnitIdentity unit, Long backupId) {
        BackupRecord record = findRollbackTarget(unit, backupId)
                .orElseThrow(() -> new RollbackNotFoundException(unit, backupId == null
                        ? "No UPDATED backup found for " + unit
                        : "Backup " + backupId + " is not an UPDATED backup of " + unit));

        log.info("Rolling back {} to backup {} from {}", unit, record.getId(), record.getCreatedAt());
        definitionStore.setText(unit, record.getOriginalText());
        journal.transition(record.getId(), BackupStatus.ROLLED_BACK);

        log.info("Rolled back {} (backup {})", unit, record.getId());
        return new RollbackResult(unit, record.getId(), record.getCreatedAt());
    }

    public RollbackResult rollback(UnitIdentity unit) {
        return rollback(unit, null);
    }

    private Optional<BackupRecord> findRollbackTarget(UnitIdentity unit, Long backupId) {
        if (backupId == null) {
            return journal.findLatestUpdated(unit);
        }
        return journal.findById(backupId)
                .filter(record -> record.getUnit().equals(unit))
                .filter(record -> record.getStatus() == BackupStatus.UPDATED);
    }
}
