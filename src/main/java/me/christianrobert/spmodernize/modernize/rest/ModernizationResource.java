package me.christianrobert.spmodernize.modernize.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.spmodernize.analysis.SyntaxIssue;
import me.christianrobert.spmodernize.catalog.CatalogScope;
import me.christianrobert.spmodernize.config.service.ConfigService;
import me.christianrobert.spmodernize.core.model.UnitIdentity;
import me.christianrobert.spmodernize.core.job.service.JobService;
import me.christianrobert.spmodernize.modernize.job.BatchModernizationJob;
import me.christianrobert.spmodernize.modernize.model.BatchSummary;
import me.christianrobert.spmodernize.modernize.model.ModernizationOptions;
import me.christianrobert.spmodernize.modernize.model.PreviewEntry;
import me.christianrobert.spmodernize.modernize.model.RollbackNotFoundException;
import me.christianrobert.spmodernize.modernize.model.RollbackResult;
import me.christianrobert.spmodernize.modernize.model.UnitApplyResult;
import me.christianrobert.spmodernize.modernize.model.UnitNotFoundException;
import me.christianrobert.spmodernize.modernize.service.ApplyController;
import me.christianrobert.spmodernize.modernize.service.PreviewService;
import me.christianrobert.spmodernize.modernize.service.RollbackController;
import me.christianrobert.spmodernize.rewrite.RewriteEngine;
import me.christianrobert.spmodernize.rewrite.RewriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Control surface for preview, apply, rollback and batch runs.
 * Unless a request explicitly says otherwise, apply and batch fall back to the configured
 * defaults, which are backup on and preview only.
 */
@ApplicationScoped
@Path("/api/modernize")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ModernizationResource {

    private static final Logger log = LoggerFactory.getLogger(ModernizationResource.class);

    @Inject
    PreviewService previewService;

    @Inject
    ApplyController applyController;

    @Inject
    RollbackController rollbackController;

    @Inject
    RewriteEngine rewriteEngine;

    @Inject
    ConfigService configService;

    @Inject
    JobService jobService;

    @Inject
    Instance<BatchModernizationJob> batchJobInstances;

    @GET
    @Path("/preview")
    public Response preview(@QueryParam("schema") String schema,
                            @QueryParam("name") String name,
                            @QueryParam("legacyOnly") @DefaultValue("true") boolean legacyOnly) {
        log.info("Previewing modernization for schema={}, name={}", schema, name);

        try {
            List<PreviewEntry> entries = previewService.preview(new CatalogScope(schema, name, legacyOnly));

            List<Map<String, Object>> units = new ArrayList<>();
            int changeCount = 0;
            for (PreviewEntry entry : entries) {
                if (entry.isWouldChange()) {
                    changeCount++;
                }
                units.add(previewToMap(entry));
            }

            Map<String, Object> result = new HashMap<>();
            result.put("status", "success");
            result.put("unitCount", entries.size());
            result.put("changeCount", changeCount);
            result.put("units", units);
            return Response.ok(result).build();

        } catch (Exception e) {
            log.error("Preview failed", e);
            return errorResponse(Response.Status.INTERNAL_SERVER_ERROR, "Preview failed: " + e.getMessage());
        }
    }

    /**
     * Rewrites text sent in the request without touching any database.
     */
    @POST
    @Path("/rewrite")
    public Response rewriteText(Map<String, Object> request) {
        Object text = request != null ? request.get("text") : null;
        if (!(text instanceof String)) {
            return errorResponse(Response.Status.BAD_REQUEST, "Request body must contain 'text'");
        }

        RewriteResult rewrite = rewriteEngine.rewriteWithReport((String) text);

        Map<String, Object> result = new HashMap<>();
        result.put("status", "success");
        result.put("changed", rewrite.isChanged());
        result.put("rewrittenText", rewrite.getRewrittenText());
        result.put("convertedStatements", rewrite.getConvertedStatements());
        result.put("skippedOccurrences", rewrite.getSkippedOccurrences());
        result.put("appliedRules", rewrite.getAppliedRules());
        result.put("reviewNotes", rewrite.getReviewNotes());
        return Response.ok(result).build();
    }

    @POST
    @Path("/apply")
    public Response apply(Map<String, Object> request) {
        UnitIdentity unit;
        ModernizationOptions options;
        try {
            unit = requireUnit(request);
            options = optionsFrom(request);
        } catch (IllegalArgumentException e) {
            return errorResponse(Response.Status.BAD_REQUEST, e.getMessage());
        }

        log.info("Applying modernization to {} with {}", unit, options);

        try {
            UnitApplyResult applyResult = applyController.apply(unit, options);

            Map<String, Object> result = applyResultToMap(applyResult);
            result.put("status", applyResult.getErrorMessage() == null ? "success" : "error");
            if (applyResult.getErrorMessage() != null) {
                result.put("message", applyResult.getErrorMessage());
                return Response.status(Response.Status.INTERNAL_SERVER_ERROR).entity(result).build();
            }
            return Response.ok(result).build();

        } catch (UnitNotFoundException e) {
            return errorResponse(Response.Status.NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            log.error("Apply failed for {}", unit, e);
            return errorResponse(Response.Status.INTERNAL_SERVER_ERROR, "Apply failed: " + e.getMessage());
        }
    }

    @POST
    @Path("/rollback")
    public Response rollback(Map<String, Object> request) {
        UnitIdentity unit;
        Long backupId;
        try {
            unit = requireUnit(request);
            backupId = optionalLong(request.get("backupId"));
        } catch (IllegalArgumentException e) {
            return errorResponse(Response.Status.BAD_REQUEST, e.getMessage());
        }

        log.info("Rolling back {} (backupId={})", unit, backupId);

        try {
            RollbackResult rollback = rollbackController.rollback(unit, backupId);

            Map<String, Object> result = new HashMap<>();
            result.put("status", "success");
            result.put("schema", unit.getSchema());
            result.put("name", unit.getName());
            result.put("backupId", rollback.getBackupId());
            result.put("backupCreatedAt", String.valueOf(rollback.getBackupCreatedAt()));
            result.put("rolledBackAt", rollback.getRolledBackAt().toString());
            result.put("message", "Original definition of " + unit + " restored");
            return Response.ok(result).build();

        } catch (RollbackNotFoundException e) {
            return errorResponse(Response.Status.NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            return errorResponse(Response.Status.CONFLICT, e.getMessage());
        } catch (Exception e) {
            log.error("Rollback of {} failed", unit, e);
            return errorResponse(Response.Status.INTERNAL_SERVER_ERROR, "Rollback failed: " + e.getMessage());
        }
    }

    @POST
    @Path("/batch")
    public Response startBatch(Map<String, Object> request) {
        Map<String, Object> body = request != null ? request : Map.of();
        Integer batchSize;
        ModernizationOptions options;
        try {
            Long size = optionalLong(body.get("batchSize"));
            batchSize = size != null ? size.intValue() : null;
            if (batchSize != null && batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be at least 1");
            }
            options = optionsFrom(body);
        } catch (IllegalArgumentException e) {
            return errorResponse(Response.Status.BAD_REQUEST, e.getMessage());
        }

        CatalogScope scope = new CatalogScope(stringOrNull(body.get("schema")), stringOrNull(body.get("name")), true);
        log.info("Starting batch modernization for {} with {}", scope, options);

        try {
            BatchModernizationJob job = batchJobInstances.get().configure(scope, options, batchSize);
            String jobId = jobService.submitJob(job);

            Map<String, Object> result = Map.of(
                    "status", "success",
                    "jobId", jobId,
                    "previewOnly", options.isPreviewOnly(),
                    "message", "Batch modernization job started successfully"
            );

            log.info("Batch modernization job started with ID: {}", jobId);
            return Response.ok(result).build();

        } catch (Exception e) {
            log.error("Failed to start batch modernization job", e);
            return errorResponse(Response.Status.INTERNAL_SERVER_ERROR,
                    "Failed to start batch modernization: " + e.getMessage());
        }
    }

    /**
     * Summary of a finished batch for the job result endpoint.
     */
    public static Map<String, Object> generateBatchSummary(BatchSummary summary) {
        Map<String, Object> result = new HashMap<>();
        result.put("totalUnits", summary.getTotalUnits());
        result.put("processed", summary.getProcessedCount());
        result.put("succeeded", summary.getSucceededCount());
        result.put("changed", summary.getChangedCount());
        result.put("applied", summary.getAppliedCount());
        result.put("previewed", summary.getPreviewedCount());
        result.put("unchanged", summary.getUnchangedCount());
        result.put("failed", summary.getFailedCount());

        Map<String, String> errors = new HashMap<>();
        summary.getErrors().forEach((unit, error) -> errors.put(unit, error.getError()));
        result.put("errors", errors);
        return result;
    }

    /**
     * Request flags override the configured defaults. Only an explicit {@code true}/{@code false}
     * (boolean or string) is accepted, so a malformed flag can never switch preview off.
     *
     * @throws IllegalArgumentException if a flag is present but not a boolean
     */
    ModernizationOptions optionsFrom(Map<String, Object> request) {
        boolean backupDefault = Boolean.TRUE.equals(configService.getConfigValueAsBoolean(ConfigService.BACKUP_ENABLED));
        Boolean previewSetting = configService.getConfigValueAsBoolean(ConfigService.PREVIEW_ONLY);
        boolean previewDefault = previewSetting == null || previewSetting;

        return new ModernizationOptions(
                booleanOrDefault("backupEnabled", request.get("backupEnabled"), backupDefault),
                booleanOrDefault("previewOnly", request.get("previewOnly"), previewDefault));
    }

    private static UnitIdentity requireUnit(Map<String, Object> request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body must contain 'schema' and 'name'");
        }
        Object schema = request.get("schema");
        Object name = request.get("name");
        if (schema == null || name == null) {
            throw new IllegalArgumentException("Request body must contain 'schema' and 'name'");
        }
        return UnitIdentity.of(schema.toString(), name.toString());
    }

    private static String stringOrNull(Object value) {
        return value != null ? value.toString() : null;
    }

    private static boolean booleanOrDefault(String field, Object value, boolean defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new IllegalArgumentException(field + " must be true or false, got: " + value);
    }

    private static Long optionalLong(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + value);
        }
    }

    private static Map<String, Object> previewToMap(PreviewEntry entry) {
        List<String> issues = new ArrayList<>();
        for (SyntaxIssue issue : entry.getIssues()) {
            issues.add(issue.getDescription());
        }

        Map<String, Object> map = new HashMap<>();
        map.put("schema", entry.getUnit().getSchema());
        map.put("name", entry.getUnit().getName());
        map.put("issueSummary", entry.getIssueSummary());
        map.put("issues", issues);
        map.put("wouldChange", entry.isWouldChange());
        map.put("convertibleStatements", entry.getConvertibleStatements());
        map.put("reviewNotes", entry.getReviewNotes());
        return map;
    }

    private static Map<String, Object> applyResultToMap(UnitApplyResult applyResult) {
        Map<String, Object> map = new HashMap<>();
        map.put("schema", applyResult.getUnit().getSchema());
        map.put("name", applyResult.getUnit().getName());
        map.put("outcome", applyResult.getOutcome().name());
        map.put("backupId", applyResult.getBackupId());
        map.put("convertedStatements", applyResult.getConvertedStatements());
        map.put("appliedRules", applyResult.getAppliedRules());
        map.put("reviewNotes", applyResult.getReviewNotes());
        return map;
    }

    private static Response errorResponse(Response.Status status, String message) {
        Map<String, Object> errorResult = Map.of(
                "status", "error",
                "message", message != null ? message : status.getReasonPhrase()
        );
        return Response.status(status).entity(errorResult).build();
    }
}
