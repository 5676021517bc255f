package me.christianrobert.spmodernize.core.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.spmodernize.core.event.ModernizationCompletedEvent;
import me.christianrobert.spmodernize.core.job.service.JobService;
import me.christianrobert.spmodernize.core.state.ModernizationStateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

@Path("/api/state")
@Produces(MediaType.APPLICATION_JSON)
public class StateRestService {

    private static final Logger log = LoggerFactory.getLogger(StateRestService.class);

    @Inject
    ModernizationStateManager stateManager;

    @Inject
    JobService jobService;

    @GET
    public Response getCurrentState() {
        log.debug("Getting current application state");

        Map<String, Object> state = new HashMap<>();
        state.put("completedRuns", stateManager.getCompletedRuns());
        state.put("totalUnitsProcessed", stateManager.getTotalUnitsProcessed());
        state.put("totalUnitsFailed", stateManager.getTotalUnitsFailed());
        state.put("knownJobs", jobService.getAllJobExecutions().size());

        ModernizationCompletedEvent lastRun = stateManager.getLastRun();
        if (lastRun != null) {
            state.put("lastRun", Map.of(
                    "jobId", lastRun.getJobId(),
                    "previewOnly", lastRun.isPreviewOnly(),
                    "processed", lastRun.getSummary().getProcessedCount(),
                    "changed", lastRun.getSummary().getChangedCount(),
                    "failed", lastRun.getSummary().getFailedCount(),
                    "finishedAt", lastRun.getTimestamp().toString()
            ));
        }

        return Response.ok(state).build();
    }

    @POST
    @Path("/reset")
    public Response resetState() {
        log.info("Resetting run history and finished jobs");

        stateManager.clear();
        int clearedJobs = jobService.clearFinishedJobs();

        return Response.ok(Map.of(
                "message", "State and job history reset successfully",
                "clearedJobs", clearedJobs
        )).build();
    }
}
