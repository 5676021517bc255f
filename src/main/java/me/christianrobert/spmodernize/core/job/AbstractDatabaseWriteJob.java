package me.christianrobert.spmodernize.core.job;

import jakarta.inject.Inject;
import me.christianrobert.spmodernize.config.service.ConfigService;
import me.christianrobert.spmodernize.core.job.model.JobProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Base class for write jobs: job id generation, the run-save-summarize flow and progress reporting.
 *
 * @param <T> The type of result being produced by the write operation
 */
public abstract class AbstractDatabaseWriteJob<T> implements DatabaseWriteJob<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractDatabaseWriteJob.class);

    protected final String jobId;

    @Inject
    protected ConfigService configService;

    protected AbstractDatabaseWriteJob() {
        this.jobId = generateJobId();
    }

    protected String generateJobId() {
        return getTargetDatabase().toLowerCase() + "-" +
               getWriteOperationType().toLowerCase().replace("_", "-") + "-" +
               UUID.randomUUID();
    }

    @Override
    public String getJobId() {
        return jobId;
    }

    @Override
    public String getJobType() {
        return getJobTypeIdentifier();
    }

    @Override
    public String getDescription() {
        return String.format("Perform %s operation on %s database",
                            getWriteOperationType().replace("_", " ").toLowerCase(),
                            getTargetDatabase());
    }

    @Override
    public CompletableFuture<T> execute(Consumer<JobProgress> progressCallback) {
        try {
            return CompletableFuture.completedFuture(performWriteOperationWithStateUpdating(progressCallback));
        } catch (Exception e) {
            log.error("{} operation failed", getWriteOperationType(), e);
            return CompletableFuture.failedFuture(new RuntimeException(String.format("%s operation failed: %s",
                    getWriteOperationType(), e.getMessage()), e));
        }
    }

    /**
     * Performs the actual write operation.
     */
    protected abstract T performWriteOperation(Consumer<JobProgress> progressCallback) throws Exception;

    /**
     * Publishes the result to whoever keeps application state.
     */
    protected abstract void saveResultsToState(T result);

    protected final T performWriteOperationWithStateUpdating(Consumer<JobProgress> progressCallback) throws Exception {
        T result = performWriteOperation(progressCallback);

        updateProgress(progressCallback, 95, "Storing results", "Publishing write operation results");
        saveResultsToState(result);

        String summaryMessage = generateSummaryMessage(result);
        updateProgress(progressCallback, 100, "Completed", summaryMessage);

        log.info("{} operation completed: {}", getWriteOperationType(), summaryMessage);
        return result;
    }

    /**
     * Default implementation only names the operation.
     */
    protected String generateSummaryMessage(T result) {
        return String.format("Write operation completed: %s",
                           getWriteOperationType().replace("_", " ").toLowerCase());
    }
}
