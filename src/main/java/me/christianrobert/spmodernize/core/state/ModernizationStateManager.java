package me.christianrobert.spmodernize.core.state;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import me.christianrobert.spmodernize.core.event.ModernizationCompletedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe holder of the latest batch modernization outcome, updated via CDI events.
 */
@ApplicationScoped
public class ModernizationStateManager {

    private static final Logger log = LoggerFactory.getLogger(ModernizationStateManager.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private ModernizationCompletedEvent lastRun;
    private int completedRuns;
    private int totalUnitsProcessed;
    private int totalUnitsFailed;

    public void onModernizationCompleted(@Observes ModernizationCompletedEvent event) {
        lock.writeLock().lock();
        try {
            log.info("Received modernization completed event: {}", event);
            lastRun = event;
            completedRuns++;
            totalUnitsProcessed += event.getSummary().getProcessedCount();
            totalUnitsFailed += event.getSummary().getFailedCount();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns null if no batch has completed yet.
     */
    public ModernizationCompletedEvent getLastRun() {
        lock.readLock().lock();
        try {
            return lastRun;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getCompletedRuns() {
        lock.readLock().lock();
        try {
            return completedRuns;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getTotalUnitsProcessed() {
        lock.readLock().lock();
        try {
            return totalUnitsProcessed;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getTotalUnitsFailed() {
        lock.readLock().lock();
        try {
            return totalUnitsFailed;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            lastRun = null;
            completedRuns = 0;
            totalUnitsProcessed = 0;
            totalUnitsFailed = 0;
            log.info("Cleared modernization run history");
        } finally {
            lock.writeLock().unlock();
        }
    }
}
