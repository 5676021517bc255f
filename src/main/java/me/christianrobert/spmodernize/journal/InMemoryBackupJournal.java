package me.christianrobert.spmodernize.journal;

import me.christianrobert.spmodernize.core.model.UnitIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Journal kept in process memory. Lost on restart; meant for dry runs and tests.
 */
public class InMemoryBackupJournal implements BackupJournal {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBackupJournal.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final TreeMap<Long, BackupRecord> records = new TreeMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    @Override
    public BackupRecord append(UnitIdentity unit, String originalText, String rewrittenText) {
        if (unit == null || originalText == null) {
            throw new JournalWriteException("Unit and original text are required for a backup record");
        }

        lock.writeLock().lock();
        try {
            BackupRecord record = new BackupRecord(nextId.getAndIncrement(), unit, originalText, rewrittenText,
                    LocalDateTime.now(), BackupStatus.BACKED_UP);
            records.put(record.getId(), record);
            log.debug("Appended backup record {} for {}", record.getId(), unit);
            return record;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public BackupRecord transition(long id, BackupStatus target) {
        lock.writeLock().lock();
        try {
            BackupRecord current = records.get(id);
            if (current == null) {
                throw new IllegalArgumentException("No backup record with id " + id);
            }
            BackupRecord updated = current.withStatus(target);
            records.put(id, updated);
            log.debug("Backup record {} moved from {} to {}", id, current.getStatus(), target);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<BackupRecord> findById(long id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(records.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<BackupRecord> findByUnit(UnitIdentity unit) {
        return find(unit.getSchema(), unit.getName(), null);
    }

    @Override
    public List<BackupRecord> findByStatus(BackupStatus status) {
        return find(null, null, status);
    }

    @Override
    public List<BackupRecord> find(String schema, String name, BackupStatus status) {
        lock.readLock().lock();
        try {
            List<BackupRecord> result = new ArrayList<>();
            for (BackupRecord record : records.values()) {
                if (schema != null && !schema.equals(record.getSchemaName())) {
                    continue;
                }
                if (name != null && !name.equals(record.getProcedureName())) {
                    continue;
                }
                if (status != null && status != record.getStatus()) {
                    continue;
                }
                result.add(record);
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<BackupRecord> findLatestUpdated(UnitIdentity unit) {
        lock.readLock().lock();
        try {
            for (BackupRecord record : records.descendingMap().values()) {
                if (record.getUnit().equals(unit) && record.getStatus() == BackupStatus.UPDATED) {
                    return Optional.of(record);
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public JournalStatistics statistics() {
        lock.readLock().lock();
        try {
            Map<BackupStatus, Integer> counts = new EnumMap<>(BackupStatus.class);
            for (BackupRecord record : records.values()) {
                counts.merge(record.getStatus(), 1, Integer::sum);
            }
            return new JournalStatistics(counts);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int purgeAll() {
        lock.writeLock().lock();
        try {
            int removed = records.size();
            records.clear();
            log.info("Purged {} backup records from in-memory journal", removed);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
