package me.christianrobert.spmodernize.core.job.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.spmodernize.core.job.model.JobProgress;
import me.christianrobert.spmodernize.core.job.model.JobStatus;
import me.christianrobert.spmodernize.core.job.service.JobService;
import me.christianrobert.spmodernize.modernize.model.BatchSummary;
import me.christianrobert.spmodernize.modernize.rest.ModernizationResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generic REST resource for job status and result retrieval.
 * Jobs are started by their domain resources.
 */
@ApplicationScoped
@Path("/api/jobs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class JobResource {

    private static final Logger log = LoggerFactory.getLogger(JobResource.class);

    @Inject
    JobService jobService;

    @GET
    public Response listJobs() {
        List<Map<String, Object>> jobs = new ArrayList<>();
        jobService.getAllJobExecutions().forEach((jobId, execution) -> {
            Map<String, Object> job = new HashMap<>();
            job.put("jobId", jobId);
            job.put("jobType", execution.getJob().getJobType());
            job.put("status", execution.getStatus().name());
            job.put("percentage", execution.getProgress().getPercentage());
            jobs.add(job);
        });
        return Response.ok(Map.of("count", jobs.size(), "jobs", jobs)).build();
    }

    @GET
    @Path("/{jobId}/status")
    public Response getJobStatus(@PathParam("jobId") String jobId) {
        log.debug("Getting job status for: {}", jobId);

        try {
            JobService.JobExecution<?> execution = jobService.getJobExecution(jobId);

            if (execution == null) {
                return jobNotFound(jobId);
            }

            JobStatus status = execution.getStatus();
            JobProgress progress = execution.getProgress();

            Map<String, Object> result = new HashMap<>();
            result.put("jobId", jobId);
            result.put("jobType", execution.getJob().getJobType());
            result.put("status", status.name());
            result.put("isComplete", jobService.isJobComplete(jobId));

            if (progress != null) {
                Map<String, Object> progressInfo = new HashMap<>();
                progressInfo.put("percentage", progress.getPercentage());
                progressInfo.put("currentTask", progress.getCurrentTask());
                progressInfo.put("details", progress.getDetails());
                progressInfo.put("lastUpdated", progress.getLastUpdated().toString());
                if (progress.getTotalUnits() != null) {
                    progressInfo.put("processedUnits", progress.getProcessedUnits());
                    progressInfo.put("totalUnits", progress.getTotalUnits());
                }
                result.put("progress", progressInfo);
            }

            if (status == JobStatus.FAILED) {
                Exception error = jobService.getJobError(jobId);
                if (error != null) {
                    result.put("error", error.getMessage());
                }
            }

            if (execution.getStartTime() != null) {
                result.put("startTime", execution.getStartTime().toString());
            }

            if (execution.getEndTime() != null) {
                result.put("endTime", execution.getEndTime().toString());
            }

            return Response.ok(result).build();

        } catch (Exception e) {
            log.error("Error getting job status for: " + jobId, e);

            Map<String, Object> errorResult = Map.of(
                    "status", "error",
                    "message", "Error getting job status: " + e.getMessage()
            );

            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(errorResult)
                    .build();
        }
    }

    @GET
    @Path("/{jobId}/result")
    public Response getJobResult(@PathParam("jobId") String jobId) {
        log.debug("Getting job result for: {}", jobId);

        try {
            JobService.JobExecution<?> execution = jobService.getJobExecution(jobId);

            if (execution == null) {
                return jobNotFound(jobId);
            }

            if (!jobService.isJobComplete(jobId)) {
                Map<String, Object> errorResult = Map.of(
                        "status", "error",
                        "message", "Job is not yet complete: " + jobId
                );
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(errorResult)
                        .build();
            }

            if (execution.getStatus() == JobStatus.FAILED) {
                Exception error = jobService.getJobError(jobId);
                Map<String, Object> errorResult = Map.of(
                        "status", "failed",
                        "jobId", jobId,
                        "message", error != null ? error.getMessage() : "Job failed with unknown error"
                );
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(errorResult)
                        .build();
            }

            Object result = jobService.getJobResult(jobId);

            Map<String, Object> response = new HashMap<>();
            response.put("status", "success");
            response.put("jobId", jobId);
            response.put("jobType", execution.getJob().getJobType());

            if (result instanceof BatchSummary) {
                BatchSummary summary = (BatchSummary) result;
                response.put("summary", ModernizationResource.generateBatchSummary(summary));
                response.put("processedCount", summary.getProcessedCount());
                response.put("succeededCount", summary.getSucceededCount());
                response.put("failedCount", summary.getFailedCount());
                response.put("isSuccessful", summary.isSuccessful());
            }
            response.put("result", result);

            return Response.ok(response).build();

        } catch (Exception e) {
            log.error("Error getting job result for: " + jobId, e);

            Map<String, Object> errorResult = Map.of(
                    "status", "error",
                    "message", "Error getting job result: " + e.getMessage()
            );

            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(errorResult)
                    .build();
        }
    }

    private static Response jobNotFound(String jobId) {
        Map<String, Object> errorResult = Map.of(
                "status", "error",
                "message", "Job not found: " + jobId
        );
        return Response.status(Response.Status.NOT_FOUND)
                .entity(errorResult)
                .build();
    }
}
