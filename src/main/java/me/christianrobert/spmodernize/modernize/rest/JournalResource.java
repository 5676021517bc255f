package me.christianrobert.spmodernize.modernize.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.spmodernize.journal.BackupJournal;
import me.christianrobert.spmodernize.journal.BackupRecord;
import me.christianrobert.spmodernize.journal.BackupStatus;
import me.christianrobert.spmodernize.journal.JournalStatistics;
import me.christianrobert.spmodernize.journal.service.JournalCleanupService;
import me.christianrobert.spmodernize.journal.service.JournalCsvExporter;
import me.christianrobert.spmodernize.journal.service.PurgeRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read access to the backup journal, CSV export and the two-step purge.
 */
@ApplicationScoped
@Path("/api/journal")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class JournalResource {

    private static final Logger log = LoggerFactory.getLogger(JournalResource.class);

    @Inject
    BackupJournal journal;

    @Inject
    JournalCsvExporter csvExporter;

    @Inject
    JournalCleanupService cleanupService;

    @GET
    public Response listRecords(@QueryParam("schema") String schema,
                                @QueryParam("name") String name,
                                @QueryParam("status") String status,
                                @QueryParam("includeText") @DefaultValue("false") boolean includeText) {
        BackupStatus statusFilter;
        try {
            statusFilter = BackupStatus.fromString(status);
        } catch (IllegalArgumentException e) {
            return errorResponse(Response.Status.BAD_REQUEST, "Unknown backup status: " + status);
        }

        try {
            List<BackupRecord> records = journal.find(schema, name, statusFilter);
            List<Map<String, Object>> items = new ArrayList<>();
            for (BackupRecord record : records) {
                items.add(recordToMap(record, includeText));
            }

            Map<String, Object> result = new HashMap<>();
            result.put("status", "success");
            result.put("count", items.size());
            result.put("records", items);
            return Response.ok(result).build();

        } catch (Exception e) {
            log.error("Failed to list journal records", e);
            return errorResponse(Response.Status.INTERNAL_SERVER_ERROR, "Failed to read journal: " + e.getMessage());
        }
    }

    @GET
    @Path("/{backupId}")
    public Response getRecord(@PathParam("backupId") long backupId) {
        try {
            return journal.findById(backupId)
                    .map(record -> {
                        Map<String, Object> result = recordToMap(record, true);
                        result.put("status", "success");
                        return Response.ok(result).build();
                    })
                    .orElseGet(() -> errorResponse(Response.Status.NOT_FOUND, "Backup record not found: " + backupId));
        } catch (Exception e) {
            log.error("Failed to read journal record {}", backupId, e);
            return errorResponse(Response.Status.INTERNAL_SERVER_ERROR, "Failed to read journal: " + e.getMessage());
        }
    }

    @GET
    @Path("/statistics")
    public Response statistics() {
        try {
            return Response.ok(statisticsToMap(journal.statistics())).build();
        } catch (Exception e) {
            log.error("Failed to read journal statistics", e);
            return errorResponse(Response.Status.INTERNAL_SERVER_ERROR, "Failed to read journal: " + e.getMessage());
        }
    }

    @GET
    @Path("/export")
    @Produces("text/csv")
    public Response exportCsv() {
        try {
            String csv = csvExporter.exportToString(journal.findAll());
            return Response.ok(csv)
                    .header("Content-Disposition", "attachment; filename=\"sp-modernization-journal.csv\"")
                    .build();
        } catch (Exception e) {
            log.error("Journal export failed", e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .type(MediaType.TEXT_PLAIN)
                    .entity("Journal export failed: " + e.getMessage())
                    .build();
        }
    }

    @POST
    @Path("/purge/request")
    public Response requestPurge() {
        try {
            PurgeRequest purgeRequest = cleanupService.requestPurge();

            Map<String, Object> result = new HashMap<>();
            result.put("status", "confirmation-required");
            result.put("token", purgeRequest.getToken());
            result.put("expiresAt", purgeRequest.getExpiresAt().toString());
            result.put("statistics", statisticsToMap(purgeRequest.getStatistics()));
            result.put("message", "Send the token to /api/journal/purge/confirm to delete all backup records");
            return Response.ok(result).build();

        } catch (Exception e) {
            log.error("Purge request failed", e);
            return errorResponse(Response.Status.INTERNAL_SERVER_ERROR, "Purge request failed: " + e.getMessage());
        }
    }

    @POST
    @Path("/purge/confirm")
    public Response confirmPurge(Map<String, Object> request) {
        Object token = request != null ? request.get("token") : null;

        try {
            int removed = cleanupService.confirmPurge(token != null ? token.toString() : null);
            return Response.ok(Map.of(
                    "status", "success",
                    "deletedRecords", removed,
                    "message", "Backup journal purged"
            )).build();

        } catch (IllegalArgumentException e) {
            return errorResponse(Response.Status.BAD_REQUEST, e.getMessage());
        } catch (IllegalStateException e) {
            return errorResponse(Response.Status.CONFLICT, e.getMessage());
        } catch (Exception e) {
            log.error("Journal purge failed", e);
            return errorResponse(Response.Status.INTERNAL_SERVER_ERROR, "Journal purge failed: " + e.getMessage());
        }
    }

    private static Map<String, Object> recordToMap(BackupRecord record, boolean includeText) {
        Map<String, Object> map = new HashMap<>();
        map.put("backupId", record.getId());
        map.put("schema", record.getSchemaName());
        map.put("name", record.getProcedureName());
        map.put("backupStatus", record.getStatus().name());
        map.put("createdAt", String.valueOf(record.getCreatedAt()));
        if (includeText) {
            map.put("originalDefinition", record.getOriginalText());
            map.put("modernizedDefinition", record.getRewrittenText());
        }
        return map;
    }

    private static Map<String, Object> statisticsToMap(JournalStatistics statistics) {
        Map<String, Object> byStatus = new HashMap<>();
        statistics.getCountByStatus().forEach((status, count) -> byStatus.put(status.name(), count));

        Map<String, Object> map = new HashMap<>();
        map.put("totalRecords", statistics.getTotalRecords());
        map.put("byStatus", byStatus);
        return map;
    }

    private static Response errorResponse(Response.Status status, String message) {
        return Response.status(status)
                .entity(Map.of("status", "error", "message", message))
                .build();
    }
}
