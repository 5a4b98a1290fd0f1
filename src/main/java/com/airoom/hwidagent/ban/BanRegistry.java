package com.airoom.hwidagent.ban;

import com.airoom.hwidagent.config.SettingsStore;
import com.airoom.hwidagent.fingerprint.Fingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 차단 지문 목록 (settings.json 의 bannedFingerprints 에 영속화).
 * 변경할 때마다 전체 목록을 다시 저장한다.
 */
public class BanRegistry {

    private static final Logger log = LoggerFactory.getLogger(BanRegistry.class);

    static final String MSG_DISABLED = "Ban simulator is disabled";
    static final String MSG_INVALID = "invalid fingerprint";

    private final SettingsStore settings;
    private final Set<String> banned;

    public BanRegistry(SettingsStore settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        // 수작업 편집으로 중복이 들어가 있어도 한 번만
        this.banned = new LinkedHashSet<>(settings.bannedFingerprints());
    }

    public synchronized BanResult ban(Fingerprint f) {
        Objects.requireNonNull(f, "fingerprint");
        if (!f.valid()) return new BanResult(false, MSG_INVALID);
        if (!banned.add(f.hash())) {
            return new BanResult(false, "HWID " + f.shortForm() + " is already banned");
        }
        persist();
        log.info("[Ban] HWID 차단: {}", f.shortForm());
        return new BanResult(true, "HWID " + f.shortForm() + " has been banned");
    }

    public synchronized BanResult unban(Fingerprint f) {
        Objects.requireNonNull(f, "fingerprint");
        if (!banned.remove(f.hash())) {
            return new BanResult(false, "HWID " + f.shortForm() + " is not banned");
        }
        persist();
        log.info("[Ban] HWID 차단 해제: {}", f.shortForm());
        return new BanResult(true, "HWID " + f.shortForm() + " has been unbanned");
    }

    /** 시뮬레이터가 꺼져 있으면 목록과 무관하게 false */
    public boolean isBanned(Fingerprint f) {
        return check(f).ok();
    }

    public synchronized BanResult check(Fingerprint f) {
        Objects.requireNonNull(f, "fingerprint");
        if (!settings.banSimulatorEnabled()) return new BanResult(false, MSG_DISABLED);
        if (banned.contains(f.hash())) {
            return new BanResult(true, "HWID " + f.shortForm() + " is BANNED");
        }
        return new BanResult(false, "HWID " + f.shortForm() + " is clean");
    }

    /** @return 해제된 건수 */
    public synchronized int clearAll() {
        int n = banned.size();
        banned.clear();
        persist();
        log.info("[Ban] 전체 차단 해제: {}건", n);
        return n;
    }

    public synchronized List<String> list() {
        return List.copyOf(banned);
    }

    private void persist() {
        settings.set(SettingsStore.BANNED_FINGERPRINTS, banned);
    }
}
