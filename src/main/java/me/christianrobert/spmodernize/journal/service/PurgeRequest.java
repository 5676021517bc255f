package me.christianrobert.spmodernize.journal.service;

import me.christianrobert.spmodernize.journal.JournalStatistics;

import java.time.Instant;

/**
 * Answer to a purge request: the token that must be sent back to confirm,
 * and what would be deleted.
 */
public class PurgeRequest {

    private final String token;
    private final Instant expiresAt;
    private final JournalStatistics statistics;

    public PurgeRequest(String token, Instant expiresAt, JournalStatistics statistics) {
        this.token = token;
        this.expiresAt = expiresAt;
        this.statistics = statistics;
    }

    public String getToken() {
        return token;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public JournalStatistics getStatistics() {
        return statistics;
    }
}
