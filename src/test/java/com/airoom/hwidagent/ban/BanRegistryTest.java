package com.airoom.hwidagent.ban;

import com.airoom.hwidagent.config.SettingsStore;
import com.airoom.hwidagent.fingerprint.Fingerprint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BanRegistryTest {

    @TempDir Path dir;

    private static final Fingerprint H1 = Fingerprint.of("1234567890abcdef" + "0".repeat(48));

    @Test
    void banTwiceKeepsOneEntry() {
        var bans = new BanRegistry(SettingsStore.inMemory());

        BanResult first = bans.ban(H1);
        BanResult second = bans.ban(H1);

        assertTrue(first.ok());
        assertEquals("HWID 12345678... has been banned", first.message());
        assertFalse(second.ok());
        assertEquals("HWID 12345678... is already banned", second.message());
        assertEquals(List.of(H1.hash()), bans.list());
    }

    @Test
    void unbanUnknownIsNotAnError() {
        var bans = new BanRegistry(SettingsStore.inMemory());

        BanResult r = bans.unban(H1);

        assertFalse(r.ok());
        assertEquals("HWID 12345678... is not banned", r.message());
    }

    @Test
    void unbanRemoves() {
        var bans = new BanRegistry(SettingsStore.inMemory());
        bans.ban(H1);

        assertTrue(bans.unban(H1).ok());
        assertFalse(bans.isBanned(H1));
        assertTrue(bans.list().isEmpty());
    }

    @Test
    void invalidFingerprintIsRefused() {
        var bans = new BanRegistry(SettingsStore.inMemory());
        BanResult r = bans.ban(Fingerprint.INVALID);
        assertFalse(r.ok());
        assertEquals("invalid fingerprint", r.message());
        assertTrue(bans.list().isEmpty());
    }

    @Test
    void disabledSimulatorReportsNotBanned() {
        var settings = SettingsStore.inMemory();
        var bans = new BanRegistry(settings);
        bans.ban(H1);

        settings.set(SettingsStore.BAN_SIMULATOR_ENABLED, false);

        assertFalse(bans.isBanned(H1));
        assertEquals("Ban simulator is disabled", bans.check(H1).message());
        assertEquals(1, bans.list().size());
    }

    @Test
    void checkMessages() {
        var bans = new BanRegistry(SettingsStore.inMemory());
        assertEquals("HWID 12345678... is clean", bans.check(H1).message());
        bans.ban(H1);
        assertEquals("HWID 12345678... is BANNED", bans.check(H1).message());
    }

    @Test
    void clearAllReturnsCount() {
        var bans = new BanRegistry(SettingsStore.inMemory());
        bans.ban(H1);
        bans.ban(Fingerprint.of("f".repeat(64)));

        assertEquals(2, bans.clearAll());
        assertTrue(bans.list().isEmpty());
        assertEquals(0, bans.clearAll());
    }

    @Test
    void bansArePersistedThroughSettings() {
        Path file = dir.resolve("settings.json");
        new BanRegistry(SettingsStore.load(file)).ban(H1);

        var reloaded = new BanRegistry(SettingsStore.load(file));

        assertTrue(reloaded.isBanned(H1));
        assertEquals(List.of(H1.hash()), SettingsStore.load(file).bannedFingerprints());
    }
}
