package me.christianrobert.spmodernize.journal.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.spmodernize.journal.BackupRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes journal records as CSV, one row per record, definitions included.
 */
@ApplicationScoped
public class JournalCsvExporter {

    private static final Logger log = LoggerFactory.getLogger(JournalCsvExporter.class);

    static final String[] HEADER = {
            "BackupId", "SchemaName", "ProcedureName", "Status", "BackupDate",
            "OriginalDefinition", "ModernizedDefinition"
    };

    private final CSVFormat csvFormat = CSVFormat.DEFAULT
            .builder()
            .setHeader(HEADER)
            .build();

    public void export(List<BackupRecord> records, Writer writer) throws IOException {
        try (CSVPrinter csvPrinter = new CSVPrinter(writer, csvFormat)) {
            for (BackupRecord record : records) {
                csvPrinter.printRecord(
                        record.getId(),
                        record.getSchemaName(),
                        record.getProcedureName(),
                        record.getStatus().name(),
                        record.getCreatedAt(),
                        record.getOriginalText(),
                        record.getRewrittenText());
            }
            csvPrinter.flush();
        }
        log.debug("Exported {} journal records as CSV", records.size());
    }

    public String exportToString(List<BackupRecord> records) {
        StringWriter writer = new StringWriter();
        try {
            export(records, writer);
        } catch (IOException e) {
            throw new UncheckedIOException("CSV export failed", e);
        }
        return writer.toString();
    }
}
