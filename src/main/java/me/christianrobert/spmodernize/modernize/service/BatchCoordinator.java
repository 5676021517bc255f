package me.christianrobert.spmodernize.modernize.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.spmodernize.core.model.SourceUnit;
import me.christianrobert.spmodernize.modernize.model.ApplyOutcome;
import me.christianrobert.spmodernize.modernize.model.BatchSummary;
import me.christianrobert.spmodernize.modernize.model.ModernizationOptions;
import me.christianrobert.spmodernize.modernize.model.UnitApplyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Runs {@link ApplyController} over a list of units, one after another.
 * A failing unit is counted and logged; the remaining units are still processed.
 * The batch as a whole is not transactional.
 */
@ApplicationScoped
public class BatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    @Inject
    ApplyController applyController;

    /**
     * @param reportInterval progress is logged and reported after every this many units (and at the end)
     * @param progressListener may be null
     */
    public BatchSummary run(List<SourceUnit> units, ModernizationOptions options, int reportInterval,
                            Consumer<BatchSummary> progressListener) {
        int interval = Math.max(1, reportInterval);
        BatchSummary summary = new BatchSummary(units.size());

        log.info("Starting batch modernization of {} units with {}", units.size(), options);

        for (SourceUnit unit : units) {
            UnitApplyResult result;
            try {
                result = applyController.apply(unit, options);
            } catch (Exception e) {
                log.error("Unexpected failure while modernizing {}", unit.getIdentity(), e);
                result = new UnitApplyResult(unit.getIdentity(), ApplyOutcome.FAILED, null, 0,
                        List.of(), List.of(), e.getMessage());
            }

            if (result.getOutcome() == ApplyOutcome.FAILED) {
                log.warn("Failed to modernize {}: {}", unit.getIdentity(), result.getErrorMessage());
            }
            summary.addUnitResult(result);

            if (summary.getProcessedCount() % interval == 0 && summary.getProcessedCount() < units.size()) {
                report(summary, progressListener);
            }
        }

        report(summary, progressListener);
        log.info("Batch modernization finished: {}", summary);
        return summary;
    }

    private void report(BatchSummary summary, Consumer<BatchSummary> progressListener) {
        log.info("Progress: {}/{} processed, {} succeeded, {} changed, {} failed",
                summary.getProcessedCount(), summary.getTotalUnits(), summary.getSucceededCount(),
                summary.getChangedCount(), summary.getFailedCount());
        if (progressListener != null) {
            progressListener.accept(summary);
        }
    }
}
