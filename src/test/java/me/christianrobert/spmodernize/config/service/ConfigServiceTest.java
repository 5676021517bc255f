package me.christianrobert.spmodernize.config.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
    }

    @Test
    void testDefaults() {
        assertTrue(configService.getConfigValueAsBoolean(ConfigService.BACKUP_ENABLED));
        assertTrue(configService.getConfigValueAsBoolean(ConfigService.PREVIEW_ONLY));
        assertEquals(10, configService.getConfigValueAsInteger(ConfigService.BATCH_SIZE, 1));
        assertEquals("jdbc", configService.getConfigValueAsString(ConfigService.JOURNAL_STORE));
        assertEquals("dbo.SP_Modernization_Backup", configService.getConfigValueAsString(ConfigService.JOURNAL_TABLE));
    }

    @Test
    void testBooleanFromString() {
        configService.setConfigValue(ConfigService.PREVIEW_ONLY, "false");

        assertFalse(configService.getConfigValueAsBoolean(ConfigService.PREVIEW_ONLY));
        assertNull(configService.getConfigValueAsBoolean("missing.key"));
    }

    @Test
    void testBooleanRejectsNonBooleanString() {
        configService.setConfigValue(ConfigService.PREVIEW_ONLY, "yes");

        assertNull(configService.getConfigValueAsBoolean(ConfigService.PREVIEW_ONLY));
    }

    @Test
    void testIntegerFallback() {
        configService.setConfigValue(ConfigService.BATCH_SIZE, " 20 ");
        assertEquals(20, configService.getConfigValueAsInteger(ConfigService.BATCH_SIZE, 1));

        configService.setConfigValue(ConfigService.BATCH_SIZE, "many");
        assertEquals(7, configService.getConfigValueAsInteger(ConfigService.BATCH_SIZE, 7));
        assertEquals(7, configService.getConfigValueAsInteger("missing.key", 7));
    }

    @Test
    void testUpdateAndReset() {
        configService.updateConfiguration(Map.of(
                ConfigService.MSSQL_URL, "jdbc:sqlserver://db:1433;databaseName=sales",
                ConfigService.JOURNAL_STORE, "memory"));

        assertEquals("memory", configService.getConfigValueAsString(ConfigService.JOURNAL_STORE));
        assertTrue(configService.hasConfigKey(ConfigService.MSSQL_URL));

        configService.resetToDefaults();

        assertEquals("jdbc", configService.getConfigValueAsString(ConfigService.JOURNAL_STORE));
        assertEquals("jdbc:sqlserver://localhost:1433;databaseName=master;encrypt=false",
                configService.getConfigValueAsString(ConfigService.MSSQL_URL));
    }

    @Test
    void testGetAllConfigurationIsACopy() {
        Map<String, Object> all = configService.getAllConfiguration();
        all.put(ConfigService.JOURNAL_STORE, "memory");

        assertEquals("jdbc", configService.getConfigValueAsString(ConfigService.JOURNAL_STORE));
    }
}
