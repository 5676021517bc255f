package me.christianrobert.spmodernize.journal;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import me.christianrobert.spmodernize.config.service.ConfigService;
import me.christianrobert.spmodernize.database.service.SqlServerConnectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the journal implementation from {@code journal.store}: {@code jdbc} (default) or {@code memory}.
 * The choice is made once, when the journal is first used.
 */
@ApplicationScoped
public class BackupJournalProducer {

    private static final Logger log = LoggerFactory.getLogger(BackupJournalProducer.class);

    @Inject
    ConfigService configService;

    @Inject
    SqlServerConnectionService connectionService;

    @Produces
    @ApplicationScoped
    public BackupJournal backupJournal() {
        return createJournal(configService.getConfigValueAsString(ConfigService.JOURNAL_STORE),
                configService.getConfigValueAsString(ConfigService.JOURNAL_TABLE));
    }

    BackupJournal createJournal(String store, String tableName) {
        if ("memory".equalsIgnoreCase(store)) {
            log.warn("Using in-memory backup journal; backups are lost on restart");
            return new InMemoryBackupJournal();
        }
        if (store != null && !"jdbc".equalsIgnoreCase(store)) {
            throw new IllegalStateException("Unknown journal store: " + store);
        }

        log.info("Using JDBC backup journal in table {}", tableName);
        return new JdbcBackupJournal(connectionService, tableName);
    }
}
