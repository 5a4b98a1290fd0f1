package com.airoom.hwidagent.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SettingsStoreTest {

    @TempDir Path dir;

    @Test
    void defaults() {
        var s = SettingsStore.inMemory();
        assertTrue(s.autoSaveReports());
        assertFalse(s.compareOnStartup());
        assertTrue(s.backupReports());
        assertEquals(10, s.maxReports());
        assertTrue(s.banSimulatorEnabled());
        assertFalse(s.backgroundMonitoring());
        assertEquals(300, s.monitoringIntervalSeconds());
        assertTrue(s.statsTracking());
        assertTrue(s.bannedFingerprints().isEmpty());
        assertEquals(4475, s.statusServerPort());
    }

    @Test
    void missingFileIsCreatedWithDefaults() {
        Path file = dir.resolve("settings.json");
        SettingsStore.load(file);
        assertTrue(Files.exists(file));
    }

    @Test
    void missingKeysAreMergedFromDefaults() throws IOException {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{\"maxReports\": 4, \"compareOnStartup\": true}");

        var s = SettingsStore.load(file);

        assertEquals(4, s.maxReports());
        assertTrue(s.compareOnStartup());
        assertTrue(s.autoSaveReports());
    }

    @Test
    void setIsPersistedImmediately() {
        Path file = dir.resolve("settings.json");
        var s = SettingsStore.load(file);
        s.set(SettingsStore.BACKGROUND_MONITORING, true);
        s.set(SettingsStore.BANNED_FINGERPRINTS, List.of("aa", "bb"));

        var reloaded = SettingsStore.load(file);
        assertTrue(reloaded.backgroundMonitoring());
        assertEquals(List.of("aa", "bb"), reloaded.bannedFingerprints());
    }

    @Test
    void unreadableFileFallsBackToDefaults() throws IOException {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{ this is not json");

        var s = SettingsStore.load(file);

        assertEquals(10, s.maxReports());
    }

    @Test
    void wrongTypesUseDefaults() throws IOException {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{\"maxReports\": \"many\", \"autoSaveReports\": 1}");

        var s = SettingsStore.load(file);

        assertEquals(10, s.maxReports());
        assertTrue(s.autoSaveReports());
    }

    @Test
    void intervalHasSixtySecondFloor() {
        var s = SettingsStore.inMemory();
        s.set(SettingsStore.MONITORING_INTERVAL_SECONDS, 5);
        assertEquals(60, s.monitoringIntervalSeconds());

        s.set(SettingsStore.MAX_REPORTS, 0);
        assertEquals(1, s.maxReports());
    }
}
