package me.christianrobert.spmodernize.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String MSSQL_URL = "mssql.url";
    public static final String MSSQL_USER = "mssql.user";
    public static final String MSSQL_PASSWORD = "mssql.password";
    public static final String BACKUP_ENABLED = "modernize.backup-enabled";
    public static final String PREVIEW_ONLY = "modernize.preview-only";
    public static final String BATCH_SIZE = "modernize.batch-size";
    public static final String JOURNAL_STORE = "journal.store";
    public static final String JOURNAL_TABLE = "journal.table";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(MSSQL_URL, "jdbc:sqlserver://localhost:1433;databaseName=master;encrypt=false");
        configuration.put(MSSQL_USER, "sa");
        configuration.put(MSSQL_PASSWORD, "xxx");
        configuration.put(BACKUP_ENABLED, true);
        configuration.put(PREVIEW_ONLY, true);
        configuration.put(BATCH_SIZE, 10);
        configuration.put(JOURNAL_STORE, "jdbc");
        configuration.put(JOURNAL_TABLE, "dbo.SP_Modernization_Backup");

        log.info("Configuration service initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Boolean.valueOf(text);
            }
        }
        return null;
    }

    /**
     * Gets a configuration value as an integer.
     * Accepts numbers and numeric strings; anything else yields the fallback.
     *
     * @param key Configuration key
     * @param fallback Value returned when the key is missing or not numeric
     */
    public int getConfigValueAsInteger(String key, int fallback) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value for {} is not a number: '{}', using {}", key, value, fallback);
            }
        }
        return fallback;
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, masked(key, value), masked(key, oldValue));
            }
        });

        log.info("Configuration updated successfully");
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, masked(key, value), masked(key, oldValue));
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }

    private static Object masked(String key, Object value) {
        return key.endsWith("password") && value != null ? "****" : value;
    }
}
