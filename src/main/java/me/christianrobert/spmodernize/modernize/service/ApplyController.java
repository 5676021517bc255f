package me.christianrobert.spmodernize.modernize.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.spmodernize.catalog.CommitException;
import me.christianrobert.spmodernize.catalog.DefinitionStore;
import me.christianrobert.spmodernize.core.model.SourceUnit;
import me.christianrobert.spmodernize.core.model.UnitIdentity;
import me.christianrobert.spmodernize.journal.BackupJournal;
import me.christianrobert.spmodernize.journal.BackupRecord;
import me.christianrobert.spmodernize.journal.BackupStatus;
import me.christianrobert.spmodernize.journal.JournalException;
import me.christianrobert.spmodernize.modernize.model.ApplyOutcome;
import me.christianrobert.spmodernize.modernize.model.ModernizationOptions;
import me.christianrobert.spmodernize.modernize.model.UnitApplyResult;
import me.christianrobert.spmodernize.modernize.model.UnitNotFoundException;
import me.christianrobert.spmodernize.rewrite.RewriteEngine;
import me.christianrobert.spmodernize.rewrite.RewriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Modernizes a single unit: rewrite, back up, commit, mark the backup UPDATED.
 *
 * <p>The order is fixed. A backup is written before anything is committed, and a failed
 * backup stops the unit. A failed commit leaves the backup in BACKED_UP. Both failures are
 * reported as {@link ApplyOutcome#FAILED} results, not thrown.</p>
 */
@ApplicationScoped
public class ApplyController {

    private static final Logger log = LoggerFactory.getLogger(ApplyController.class);

    @Inject
    RewriteEngine rewriteEngine;

    @Inject
    BackupJournal journal;

    @Inject
    DefinitionStore definitionStore;

    /**
     * Reads the current definition from the store and modernizes it.
     *
     * @throws UnitNotFoundException if the store has no such unit
     */
    public UnitApplyResult apply(UnitIdentity unit, ModernizationOptions options) {
        String text = definitionStore.getText(unit)
                .orElseThrow(() -> new UnitNotFoundException(unit));
        return apply(new SourceUnit(unit, text), options);
    }

    public UnitApplyResult apply(SourceUnit unit, ModernizationOptions options) {
        UnitIdentity identity = unit.getIdentity();
        RewriteResult rewrite = rewriteEngine.rewriteWithReport(unit.getText());

        if (!rewrite.isChanged()) {
            log.debug("{} has no deprecated syntax to rewrite", identity);
            return UnitApplyResult.unchanged(identity);
        }

        Long backupId = null;
        if (options.isBackupEnabled()) {
            try {
                BackupRecord record = journal.append(identity, rewrite.getOriginalText(), rewrite.getRewrittenText());
                backupId = record.getId();
                log.debug("Backed up {} as record {}", identity, backupId);
            } catch (JournalException e) {
                log.error("Backup of {} failed, not committing", identity, e);
                return failed(identity, rewrite, null, "Backup failed: " + e.getMessage());
            }
        }

        if (options.isPreviewOnly()) {
            log.info("Preview: {} would be modernized ({} RAISERROR statements, rules {})",
                    identity, rewrite.getConvertedStatements(), rewrite.getAppliedRules());
            return result(identity, ApplyOutcome.PREVIEWED, backupId, rewrite, null);
        }

        try {
            definitionStore.setText(identity, rewrite.getRewrittenText());
        } catch (CommitException e) {
            log.error("Commit of {} failed; backup {} stays {}", identity, backupId, BackupStatus.BACKED_UP, e);
            return failed(identity, rewrite, backupId, "Commit failed: " + e.getMessage());
        }

        if (backupId != null) {
            try {
                journal.transition(backupId, BackupStatus.UPDATED);
            } catch (JournalException | IllegalStateException | IllegalArgumentException e) {
                log.error("{} was committed but backup {} could not be marked {}", identity, backupId,
                        BackupStatus.UPDATED, e);
                return failed(identity, rewrite, backupId,
                        "Committed, but backup " + backupId + " could not be marked UPDATED: " + e.getMessage());
            }
        }

        log.info("Modernized {} ({} RAISERROR statements, rules {})",
                identity, rewrite.getConvertedStatements(), rewrite.getAppliedRules());
        if (rewrite.needsManualReview()) {
            log.warn("{} needs manual review: {}", identity, rewrite.getReviewNotes());
        }
        return result(identity, ApplyOutcome.APPLIED, backupId, rewrite, null);
    }

    private static UnitApplyResult failed(UnitIdentity identity, RewriteResult rewrite, Long backupId, String message) {
        return result(identity, ApplyOutcome.FAILED, backupId, rewrite, message);
    }

    private static UnitApplyResult result(UnitIdentity identity, ApplyOutcome outcome, Long backupId,
                                          RewriteResult rewrite, String errorMessage) {
        return new UnitApplyResult(identity, outcome, backupId, rewrite.getConvertedStatements(),
                rewrite.getAppliedRules(), rewrite.getReviewNotes(), errorMessage);
    }
}
