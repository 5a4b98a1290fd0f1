package com.airoom.hwidagent;

import com.airoom.hwidagent.config.SettingsStore;
import com.airoom.hwidagent.fingerprint.Fingerprint;
import com.airoom.hwidagent.report.DriftResult;
import com.airoom.hwidagent.report.DriftStatus;
import com.airoom.hwidagent.store.FileDataStore;
import com.airoom.hwidagent.support.FakeCollector;
import com.airoom.hwidagent.support.MutableClock;
import com.airoom.hwidagent.support.Snapshots;
import com.airoom.hwidagent.task.AntiCheatVerdict;
import com.airoom.hwidagent.task.BanCurrentOutcome;
import com.airoom.hwidagent.task.CollectOutcome;
import com.airoom.hwidagent.task.TaskKind;
import com.airoom.hwidagent.task.TaskResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class HwidAgentTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @TempDir Path dir;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-07-01T08:00:00Z"));
    private HwidAgent agent;

    @AfterEach
    void tearDown() {
        if (agent != null) agent.close();
    }

    private HwidAgent newAgent(FakeCollector collector, SettingsStore settings) throws IOException {
        return new HwidAgent(collector, new FileDataStore(dir), settings, clock, Duration.ofMillis(1));
    }

    private TaskResult run(TaskKind kind) {
        return agent.poll(agent.submit(kind), WAIT).orElseThrow();
    }

    @Test
    void endToEndThroughTheWorker() throws IOException {
        var collector = new FakeCollector(Snapshots.of("X1", "B1"));
        agent = newAgent(collector, SettingsStore.load(dir.resolve("settings.json")));
        agent.start();

        CollectOutcome collected = run(TaskKind.COLLECT).payloadAs(CollectOutcome.class);
        assertTrue(collected.saved());
        Fingerprint h1 = collected.fingerprint();

        assertEquals(DriftStatus.UNCHANGED, run(TaskKind.COMPARE_ONLY).payloadAs(DriftResult.class).status());

        collector.set(Snapshots.of("X2", "B1"));
        DriftResult changed = run(TaskKind.COMPARE_ONLY).payloadAs(DriftResult.class);
        assertEquals(DriftStatus.CHANGED, changed.status());
        Fingerprint h2 = changed.current();
        assertNotEquals(h1, h2);
        assertEquals(1, agent.stats().totalChanges());

        assertTrue(agent.ban(h2).ok());
        assertTrue(agent.isBanned(h2));
        assertTrue(run(TaskKind.RUN_ANTI_CHEAT_CHECK).payloadAs(AntiCheatVerdict.class).banned());
        assertEquals(1, agent.bannedFingerprints().size());
    }

    @Test
    void banCurrentTaskSucceedsEvenWhenAlreadyBanned() throws IOException {
        agent = newAgent(new FakeCollector(Snapshots.of("X1", "B1")), SettingsStore.inMemory());
        agent.start();

        TaskResult first = run(TaskKind.BAN_CURRENT);
        TaskResult second = run(TaskKind.BAN_CURRENT);

        assertTrue(first.isSuccess());
        assertTrue(first.payloadAs(BanCurrentOutcome.class).banned());
        assertTrue(second.isSuccess());
        assertFalse(second.payloadAs(BanCurrentOutcome.class).banned());
        assertEquals(1, agent.clearAllBans());
    }

    @Test
    void collectionFailureIsAnErrorResult() throws IOException {
        agent = newAgent(new FakeCollector(null), SettingsStore.inMemory());
        agent.start();

        TaskResult r = run(TaskKind.COLLECT);

        assertFalse(r.isSuccess());
        assertEquals("Failed to collect HWID data", r.errorMessage());
    }

    @Test
    void compareOnStartupOnlyWhenEnabled() throws IOException {
        var settings = SettingsStore.inMemory();
        agent = newAgent(new FakeCollector(Snapshots.of("X1", "B1")), settings);
        agent.start();

        assertTrue(agent.compareOnStartup(WAIT).isEmpty());

        settings.set(SettingsStore.COMPARE_ON_STARTUP, true);
        TaskResult r = agent.compareOnStartup(WAIT).orElseThrow();
        assertEquals(DriftStatus.NO_BASELINE, r.payloadAs(DriftResult.class).status());
        assertTrue(agent.currentFingerprint().isPresent());
    }

    @Test
    void backgroundMonitoringStartsFromSettings() throws IOException {
        var settings = SettingsStore.inMemory();
        settings.set(SettingsStore.BACKGROUND_MONITORING, true);
        agent = newAgent(new FakeCollector(Snapshots.of("X1", "B1")), settings);

        agent.start();
        assertTrue(agent.monitoringStatus().active());

        agent.stopMonitoring();
        assertFalse(agent.monitoringStatus().active());
    }
}
