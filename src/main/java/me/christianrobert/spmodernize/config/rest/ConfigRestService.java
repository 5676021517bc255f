package me.christianrobert.spmodernize.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.spmodernize.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        log.info("Getting configuration");

        Map<String, Object> config = configService.getAllConfiguration();
        if (config.containsKey(ConfigService.MSSQL_PASSWORD)) {
            config.put(ConfigService.MSSQL_PASSWORD, "****");
        }
        return Response.ok(config).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        log.info("Saving configuration with {} entries", config.size());

        String invalid = validate(config);
        if (invalid != null) {
            return errorResponse(Response.Status.BAD_REQUEST, invalid);
        }

        try {
            configService.updateConfiguration(config);

            Map<String, String> response = new HashMap<>();
            response.put("status", "success");
            response.put("message", "Configuration saved successfully");

            return Response.ok(response).build();
        } catch (Exception e) {
            log.error("Error saving configuration", e);
            return errorResponse(Response.Status.INTERNAL_SERVER_ERROR,
                    "Failed to save configuration: " + e.getMessage());
        }
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        log.debug("Getting config value for key: {}", key);

        Object value = configService.getConfigValue(key);
        if (value == null) {
            return errorResponse(Response.Status.NOT_FOUND, "Configuration key not found: " + key);
        }

        return Response.ok(Map.of("key", key, "value", value)).build();
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        log.debug("Setting config value for key: {}", key);

        if (body == null || !body.containsKey("value")) {
            return errorResponse(Response.Status.BAD_REQUEST, "Request body must contain 'value' field");
        }

        Object value = body.get("value");
        String invalid = validate(Map.of(key, value));
        if (invalid != null) {
            return errorResponse(Response.Status.BAD_REQUEST, invalid);
        }

        configService.setConfigValue(key, value);

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Configuration value updated successfully");
        response.put("key", key);

        return Response.ok(response).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        log.info("Resetting configuration to defaults");

        try {
            configService.resetToDefaults();

            Map<String, String> response = new HashMap<>();
            response.put("status", "success");
            response.put("message", "Configuration reset to defaults successfully");

            return Response.ok(response).build();
        } catch (Exception e) {
            log.error("Error resetting configuration", e);
            return errorResponse(Response.Status.INTERNAL_SERVER_ERROR,
                    "Failed to reset configuration: " + e.getMessage());
        }
    }

    private static String validate(Map<String, Object> config) {
        Object batchSize = config.get(ConfigService.BATCH_SIZE);
        if (batchSize != null) {
            try {
                if (Integer.parseInt(batchSize.toString().trim()) < 1) {
                    return ConfigService.BATCH_SIZE + " must be at least 1";
                }
            } catch (NumberFormatException e) {
                return ConfigService.BATCH_SIZE + " must be a number";
            }
        }

        for (String key : new String[]{ConfigService.PREVIEW_ONLY, ConfigService.BACKUP_ENABLED}) {
            Object flag = config.get(key);
            if (flag != null && !(flag instanceof Boolean)
                    && !"true".equalsIgnoreCase(flag.toString().trim())
                    && !"false".equalsIgnoreCase(flag.toString().trim())) {
                return key + " must be true or false";
            }
        }

        Object store = config.get(ConfigService.JOURNAL_STORE);
        if (store != null && !"jdbc".equals(store.toString()) && !"memory".equals(store.toString())) {
            return ConfigService.JOURNAL_STORE + " must be 'jdbc' or 'memory'";
        }
        return null;
    }

    private static Response errorResponse(Response.Status status, String message) {
        Map<String, String> errorResponse = new HashMap<>();
        errorResponse.put("status", "error");
        errorResponse.put("message", message);
        return Response.status(status).entity(errorResponse).build();
    }
}
