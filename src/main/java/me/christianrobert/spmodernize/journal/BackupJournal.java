package me.christianrobert.spmodernize.journal;

import me.christianrobert.spmodernize.core.model.UnitIdentity;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store of {@link BackupRecord}s. Records are never overwritten: only their
 * status moves forward, and only {@link #purgeAll()} removes them.
 *
 * <p>Write operations throw {@link JournalWriteException} when the backing store fails.</p>
 */
public interface BackupJournal {

    /**
     * Stores a new record in status {@link BackupStatus#BACKED_UP}.
     *
     * @return the stored record with its assigned id
     */
    BackupRecord append(UnitIdentity unit, String originalText, String rewrittenText);

    /**
     * Moves a record one step forward in its lifecycle.
     *
     * @throws IllegalArgumentException if no record has this id
     * @throws IllegalStateException if the record is not in the predecessor status of {@code target}
     */
    BackupRecord transition(long id, BackupStatus target);

    Optional<BackupRecord> findById(long id);

    /** All records of one unit, oldest first. */
    List<BackupRecord> findByUnit(UnitIdentity unit);

    List<BackupRecord> findByStatus(BackupStatus status);

    /**
     * Filtered listing, oldest first. Null arguments do not filter.
     */
    List<BackupRecord> find(String schema, String name, BackupStatus status);

    default List<BackupRecord> findAll() {
        return find(null, null, null);
    }

    /**
     * @return the record with the highest id among the unit's UPDATED records
     */
    Optional<BackupRecord> findLatestUpdated(UnitIdentity unit);

    JournalStatistics statistics();

    /**
     * Deletes every record.
     *
     * @return number of records removed
     */
    int purgeAll();
}
