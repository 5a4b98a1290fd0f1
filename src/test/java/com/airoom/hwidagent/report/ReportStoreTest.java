package com.airoom.hwidagent.report;

import com.airoom.hwidagent.config.SettingsStore;
import com.airoom.hwidagent.fingerprint.FingerprintEngine;
import com.airoom.hwidagent.store.FileDataStore;
import com.airoom.hwidagent.support.InMemoryDataStore;
import com.airoom.hwidagent.support.MutableClock;
import com.airoom.hwidagent.support.Snapshots;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ReportStoreTest {

    @TempDir Path dir;

    @Test
    void firstCompareHasNoBaseline() throws IOException {
        var reports = new ReportStore(new FileDataStore(dir), SettingsStore.inMemory());

        DriftResult r = reports.compare(Snapshots.of("X1", "B1"));

        assertEquals(DriftStatus.NO_BASELINE, r.status());
        assertEquals("No previous report found", r.message());
        assertNull(r.previous());
        assertFalse(r.changed());
    }

    @Test
    void unchangedThenChanged() throws IOException {
        var reports = new ReportStore(new FileDataStore(dir), SettingsStore.inMemory());
        assertTrue(reports.save(Snapshots.of("X1", "B1")));

        DriftResult same = reports.compare(Snapshots.of("X1", "B1"));
        assertEquals(DriftStatus.UNCHANGED, same.status());
        assertEquals("HWID matches previous report", same.message());

        DriftResult changed = reports.compare(Snapshots.of("X2", "B1"));
        assertEquals(DriftStatus.CHANGED, changed.status());
        assertEquals("HWID has changed from previous report", changed.message());
        assertEquals(FingerprintEngine.compute(Snapshots.of("X1", "B1")), changed.previous());
        assertEquals(FingerprintEngine.compute(Snapshots.of("X2", "B1")), changed.current());
    }

    @Test
    void compareDoesNotSave() throws IOException {
        var reports = new ReportStore(new FileDataStore(dir), SettingsStore.inMemory());
        reports.compare(Snapshots.of("X1", "B1"));
        assertTrue(reports.loadCurrent().isEmpty());
    }

    @Test
    void historyIsCappedAtMaxReportsKeepingNewest() throws IOException {
        var settings = SettingsStore.inMemory();
        settings.set(SettingsStore.MAX_REPORTS, 3);
        var clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
        var reports = new ReportStore(new FileDataStore(dir), settings, clock);

        for (int i = 0; i < 3 + 4; i++) {
            assertTrue(reports.save(Snapshots.of("X" + i, "B1")));
            clock.advance(Duration.ofMinutes(1));
        }

        var history = reports.history();
        assertEquals(3, history.size());
        assertEquals(Instant.parse("2024-05-01T00:06:00Z"), history.get(0).createdAt());
        assertEquals(Instant.parse("2024-05-01T00:04:00Z"), history.get(2).createdAt());
        try (Stream<Path> s = Files.list(dir.resolve("reports"))) {
            assertEquals(3, s.count());
        }
        assertEquals(FingerprintEngine.compute(Snapshots.of("X6", "B1")),
                reports.loadCurrent().orElseThrow().fingerprint());
    }

    @Test
    void noHistoryWhenBackupDisabled() throws IOException {
        var settings = SettingsStore.inMemory();
        settings.set(SettingsStore.BACKUP_REPORTS, false);
        var reports = new ReportStore(new FileDataStore(dir), settings);

        assertTrue(reports.save(Snapshots.of("X1", "B1")));

        assertTrue(reports.history().isEmpty());
        assertTrue(reports.loadCurrent().isPresent());
    }

    @Test
    void saveReturnsFalseOnPersistenceFailure() {
        var store = new InMemoryDataStore();
        store.failWrites = true;
        var reports = new ReportStore(store, SettingsStore.inMemory());

        assertFalse(reports.save(Snapshots.of("X1", "B1")));
        assertTrue(reports.loadCurrent().isEmpty());
    }

    @Test
    void failedSaveKeepsPreviousCurrent() {
        var store = new InMemoryDataStore();
        var reports = new ReportStore(store, SettingsStore.inMemory());
        assertTrue(reports.save(Snapshots.of("X1", "B1")));

        store.failWrites = true;
        assertFalse(reports.save(Snapshots.of("X2", "B1")));

        assertEquals(DriftStatus.UNCHANGED, reports.compare(Snapshots.of("X1", "B1")).status());
    }
}
