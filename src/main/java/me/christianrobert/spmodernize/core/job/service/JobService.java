package me.christianrobert.spmodernize.core.job.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.spmodernize.core.job.Job;
import me.christianrobert.spmodernize.core.job.model.JobProgress;
import me.christianrobert.spmodernize.core.job.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs submitted jobs in the background and keeps their status for polling.
 *
 * <p>Jobs run on a single worker thread, one after another. Two batches submitted
 * at the same time never modify procedures concurrently.</p>
 */
@ApplicationScoped
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final Map<String, JobExecution<?>> jobExecutions = new ConcurrentHashMap<>();

    private ExecutorService executorService;

    @PostConstruct
    public void init() {
        log.info("Initializing job executor");
        executorService = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "modernization-job");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Waits up to 30 seconds for a running job to complete.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down job executor");
        shutdownExecutorService(executorService, 30);
    }

    private void shutdownExecutorService(ExecutorService executor, int timeoutSeconds) {
        if (executor == null || executor.isShutdown()) {
            return;
        }

        try {
            executor.shutdown();

            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Executor did not terminate in {}s, forcing shutdown", timeoutSeconds);
                executor.shutdownNow();

                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.error("Executor did not terminate after forced shutdown");
                }
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while shutting down executor service", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static class JobExecution<T> {
        private final Job<T> job;
        private volatile JobStatus status;
        private volatile JobProgress progress;
        private volatile LocalDateTime startTime;
        private volatile LocalDateTime endTime;
        private volatile T result;
        private volatile Exception error;
        private CompletableFuture<T> future;

        public JobExecution(Job<T> job) {
            this.job = job;
            this.status = JobStatus.PENDING;
            this.progress = new JobProgress();
        }

        public Job<T> getJob() { return job; }
        public JobStatus getStatus() { return status; }
        public void setStatus(JobStatus status) { this.status = status; }
        public JobProgress getProgress() { return progress; }
        public void setProgress(JobProgress progress) { this.progress = progress; }
        public LocalDateTime getStartTime() { return startTime; }
        public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }
        public LocalDateTime getEndTime() { return endTime; }
        public void setEndTime(LocalDateTime endTime) { this.endTime = endTime; }
        public T getResult() { return result; }
        public void setResult(T result) { this.result = result; }
        public Exception getError() { return error; }
        public void setError(Exception error) { this.error = error; }
        public CompletableFuture<T> getFuture() { return future; }
        public void setFuture(CompletableFuture<T> future) { this.future = future; }
    }

    public <T> String submitJob(Job<T> job) {
        String jobId = job.getJobId();

        log.info("Submitting job: {} ({})", jobId, job.getJobType());

        JobExecution<T> execution = new JobExecution<>(job);
        jobExecutions.put(jobId, execution);

        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            execution.setStatus(JobStatus.RUNNING);
            execution.setStartTime(LocalDateTime.now());

            log.info("Starting job execution: {}", jobId);

            try {
                T result = job.execute(progress -> {
                    execution.setProgress(progress);
                    log.debug("Job {} progress: {}%", jobId, progress.getPercentage());
                }).get();

                execution.setResult(result);
                execution.setStatus(JobStatus.COMPLETED);
                execution.setEndTime(LocalDateTime.now());

                log.info("Job completed successfully: {}", jobId);
                return result;

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                markFailed(execution, e);
                throw new RuntimeException("Job execution interrupted: " + jobId, e);
            } catch (Exception e) {
                markFailed(execution, e);
                throw new RuntimeException("Job execution failed: " + e.getMessage(), e);
            }
        }, executorService);

        execution.setFuture(future);
        return jobId;
    }

    private void markFailed(JobExecution<?> execution, Exception e) {
        execution.setError(e);
        execution.setStatus(JobStatus.FAILED);
        execution.setEndTime(LocalDateTime.now());
        log.error("Job failed: {}", execution.getJob().getJobId(), e);
    }

    public JobExecution<?> getJobExecution(String jobId) {
        return jobExecutions.get(jobId);
    }

    public JobStatus getJobStatus(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        return execution != null ? execution.getStatus() : null;
    }

    public JobProgress getJobProgress(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        return execution != null ? execution.getProgress() : null;
    }

    public <T> T getJobResult(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        if (execution != null && execution.getStatus() == JobStatus.COMPLETED) {
            @SuppressWarnings("unchecked")
            T result = (T) execution.getResult();
            return result;
        }
        return null;
    }

    public Exception getJobError(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        if (execution != null && execution.getStatus() == JobStatus.FAILED) {
            return execution.getError();
        }
        return null;
    }

    public boolean isJobComplete(String jobId) {
        JobStatus status = getJobStatus(jobId);
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED;
    }

    public Map<String, JobExecution<?>> getAllJobExecutions() {
        return Map.copyOf(jobExecutions);
    }

    /**
     * Forgets finished jobs. Pending and running jobs are kept.
     *
     * @return number of removed executions
     */
    public int clearFinishedJobs() {
        int before = jobExecutions.size();
        jobExecutions.values().removeIf(execution -> isJobComplete(execution.getJob().getJobId()));
        int removed = before - jobExecutions.size();
        log.info("Cleared {} finished job executions", removed);
        return removed;
    }
}
