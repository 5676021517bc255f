package me.christianrobert.spmodernize.modernize.job;

import jakarta.enterprise.context.Dependent;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import me.christianrobert.spmodernize.catalog.CatalogProvider;
import me.christianrobert.spmodernize.catalog.CatalogScope;
import me.christianrobert.spmodernize.config.service.ConfigService;
import me.christianrobert.spmodernize.core.event.ModernizationCompletedEvent;
import me.christianrobert.spmodernize.core.job.AbstractDatabaseWriteJob;
import me.christianrobert.spmodernize.core.job.model.JobProgress;
import me.christianrobert.spmodernize.core.model.SourceUnit;
import me.christianrobert.spmodernize.modernize.model.BatchSummary;
import me.christianrobert.spmodernize.modernize.model.ModernizationOptions;
import me.christianrobert.spmodernize.modernize.service.BatchCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Background job that modernizes every legacy stored procedure in a scope.
 * Must be {@link #configure configured} before it is submitted.
 */
@Dependent
public class BatchModernizationJob extends AbstractDatabaseWriteJob<BatchSummary> {

    private static final Logger log = LoggerFactory.getLogger(BatchModernizationJob.class);

    @Inject
    CatalogProvider catalogProvider;

    @Inject
    BatchCoordinator batchCoordinator;

    @Inject
    Event<ModernizationCompletedEvent> completedEvent;

    private CatalogScope scope = new CatalogScope(null, null, true);
    private ModernizationOptions options = ModernizationOptions.defaults();
    private Integer batchSize;

    @Override
    public String getTargetDatabase() {
        return "SQLSERVER";
    }

    @Override
    public String getWriteOperationType() {
        return "PROCEDURE_MODERNIZATION";
    }

    @Override
    public Class<BatchSummary> getResultType() {
        return BatchSummary.class;
    }

    /**
     * @param batchSize units between progress reports; null uses {@code modernize.batch-size}
     */
    public BatchModernizationJob configure(CatalogScope scope, ModernizationOptions options, Integer batchSize) {
        this.scope = scope;
        this.options = options;
        this.batchSize = batchSize;
        return this;
    }

    public CatalogScope getScope() {
        return scope;
    }

    public ModernizationOptions getOptions() {
        return options;
    }

    @Override
    protected BatchSummary performWriteOperation(Consumer<JobProgress> progressCallback) throws Exception {
        updateProgress(progressCallback, 0, "Initializing", "Reading stored procedures for " + scope);

        List<SourceUnit> units = catalogProvider.findUnits(scope);
        if (units.isEmpty()) {
            updateProgress(progressCallback, 90, "No procedures to process",
                    "No stored procedures with deprecated syntax found for " + scope);
            log.info("No stored procedures to modernize for {}", scope);
            return new BatchSummary(0);
        }

        int interval = batchSize != null
                ? batchSize
                : configService.getConfigValueAsInteger(ConfigService.BATCH_SIZE, 10);
        String mode = options.isPreviewOnly() ? "Previewing" : "Modernizing";

        updateProgress(progressCallback, 5, mode + " procedures",
                String.format("Found %d stored procedures, reporting every %d", units.size(), interval));

        return batchCoordinator.run(units, options, interval,
                summary -> reportBatchProgress(progressCallback, summary, mode));
    }

    private void reportBatchProgress(Consumer<JobProgress> progressCallback, BatchSummary summary, String mode) {
        if (progressCallback == null) {
            return;
        }
        progressCallback.accept(JobProgress.forUnits(summary.getProcessedCount(), summary.getTotalUnits(), 90,
                mode + " procedures",
                String.format("%d/%d processed, %d changed, %d failed", summary.getProcessedCount(),
                        summary.getTotalUnits(), summary.getChangedCount(), summary.getFailedCount())));
    }

    @Override
    protected void saveResultsToState(BatchSummary result) {
        completedEvent.fire(new ModernizationCompletedEvent(jobId, options.isPreviewOnly(), result));
    }

    @Override
    protected String generateSummaryMessage(BatchSummary result) {
        return String.format("Batch modernization completed: %d processed, %d changed, %d unchanged, %d failed%s",
                result.getProcessedCount(), result.getChangedCount(), result.getUnchangedCount(),
                result.getFailedCount(), options.isPreviewOnly() ? " (preview only)" : "");
    }
}
