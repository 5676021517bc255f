package me.christianrobert.spmodernize.journal.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.spmodernize.journal.BackupJournal;
import me.christianrobert.spmodernize.journal.JournalStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deletes journal history in two steps. {@link #requestPurge()} hands out a token;
 * only {@link #confirmPurge(String)} with that token, within {@link #TOKEN_VALIDITY},
 * actually deletes. A token works once.
 */
@ApplicationScoped
public class JournalCleanupService {

    private static final Logger log = LoggerFactory.getLogger(JournalCleanupService.class);

    public static final Duration TOKEN_VALIDITY = Duration.ofMinutes(10);

    @Inject
    BackupJournal journal;

    private final Map<String, Instant> pendingTokens = new ConcurrentHashMap<>();

    private Clock clock = Clock.systemUTC();

    public PurgeRequest requestPurge() {
        Instant now = clock.instant();
        pendingTokens.values().removeIf(expiry -> expiry.isBefore(now));

        String token = UUID.randomUUID().toString();
        Instant expiresAt = now.plus(TOKEN_VALIDITY);
        pendingTokens.put(token, expiresAt);

        JournalStatistics statistics = journal.statistics();
        log.warn("Journal purge requested; {} records would be deleted. Confirmation token valid until {}",
                statistics.getTotalRecords(), expiresAt);
        return new PurgeRequest(token, expiresAt, statistics);
    }

    /**
     * @return number of deleted records
     * @throws IllegalArgumentException if the token is unknown or already used
     * @throws IllegalStateException if the token has expired
     */
    public int confirmPurge(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("A confirmation token is required to purge the journal");
        }

        Instant expiresAt = pendingTokens.remove(token);
        if (expiresAt == null) {
            throw new IllegalArgumentException("Unknown or already used purge token");
        }
        if (clock.instant().isAfter(expiresAt)) {
            throw new IllegalStateException("Purge token expired at " + expiresAt + "; request a new one");
        }

        int removed = journal.purgeAll();
        log.warn("Journal purged: {} records deleted", removed);
        return removed;
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }
}
