package me.christianrobert.spmodernize.database.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.spmodernize.database.service.SqlServerConnectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

@Path("/api/database/test")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConnectionTestResource {

    private static final Logger log = LoggerFactory.getLogger(ConnectionTestResource.class);

    @Inject
    SqlServerConnectionService sqlServerConnectionService;

    @GET
    @Path("/sqlserver")
    public Response testSqlServerConnection() {
        log.info("Testing SQL Server connection via REST API");

        try {
            Map<String, Object> result = sqlServerConnectionService.testConnection();

            if ("success".equals(result.get("status"))) {
                return Response.ok(result).build();
            }
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(result)
                    .build();

        } catch (Exception e) {
            log.error("Unexpected error during SQL Server connection test", e);

            Map<String, Object> errorResult = Map.of(
                    "status", "error",
                    "connected", false,
                    "message", "Unexpected error: " + e.getMessage()
            );

            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(errorResult)
                    .build();
        }
    }

    @GET
    @Path("/status")
    public Response getConnectionStatus() {
        boolean configured = sqlServerConnectionService.isConfigured();
        return Response.ok(Map.of(
                "sqlserver", Map.of(
                        "configured", configured,
                        "configurationStatus", configured
                                ? "Connection parameters are configured"
                                : "Connection parameters are missing or incomplete"
                )
        )).build();
    }
}
