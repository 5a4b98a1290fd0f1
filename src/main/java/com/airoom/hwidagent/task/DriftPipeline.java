package com.airoom.hwidagent.task;

import com.airoom.hwidagent.ban.BanRegistry;
import com.airoom.hwidagent.ban.BanResult;
import com.airoom.hwidagent.config.SettingsStore;
import com.airoom.hwidagent.device.HardwareCollector;
import com.airoom.hwidagent.device.Snapshot;
import com.airoom.hwidagent.fingerprint.Fingerprint;
import com.airoom.hwidagent.report.DriftResult;
import com.airoom.hwidagent.report.DriftStatus;
import com.airoom.hwidagent.report.ReportStore;
import com.airoom.hwidagent.stats.StatsTracker;
import com.airoom.hwidagent.stats.StatsView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 수집 → 지문 → 비교 → 저장 → 차단 확인 시퀀스.
 * 워커 핸들러와 백그라운드 모니터가 같은 인스턴스를 공유하며,
 * 리포트/통계/차단 목록의 읽기-수정-쓰기는 전부 {@link #lock} 안에서만 실행된다.
 * 하드웨어 수집(느림)은 락 밖에서.
 */
public class DriftPipeline implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(DriftPipeline.class);

    public static final String MSG_COLLECT_FAILED = "Failed to collect HWID data";
    public static final String MSG_SAVE_FAILED = "Failed to save HWID report";

    private final HardwareCollector collector;
    private final ReportStore reports;
    private final StatsTracker stats;
    private final BanRegistry bans;
    private final SettingsStore settings;
    private final ReentrantLock lock = new ReentrantLock();

    public DriftPipeline(HardwareCollector collector, ReportStore reports, StatsTracker stats,
                         BanRegistry bans, SettingsStore settings) {
        this.collector = Objects.requireNonNull(collector, "collector");
        this.reports = Objects.requireNonNull(reports, "reports");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.bans = Objects.requireNonNull(bans, "bans");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public Object handle(TaskKind kind, Consumer<String> progress) throws TaskFailedException {
        return switch (kind) {
            case COLLECT              -> collect(progress);
            case COMPARE_ONLY         -> compareOnly(progress);
            case BAN_CURRENT          -> banCurrent(progress);
            case RUN_ANTI_CHEAT_CHECK -> antiCheatCheck(progress);
            case FETCH_STATS          -> stats.view();
        };
    }

    /** 수집 후 autoSaveReports 가 켜져 있으면 저장 */
    public CollectOutcome collect(Consumer<String> progress) throws TaskFailedException {
        progress.accept("Collecting HWID data...");
        Snapshot snap = collectOrFail();
        Fingerprint fp = reports.generateFingerprint(snap);

        boolean saved = false;
        if (settings.autoSaveReports()) {
            progress.accept("Saving report...");
            lock.lock();
            try {
                saved = reports.save(snap);
            } finally {
                lock.unlock();
            }
        }
        return new CollectOutcome(snap, fp, saved);
    }

    /** 비교 + 통계 기록. 기준 리포트가 없으면 (autoSave 시) 이번 수집분을 기준으로 저장 */
    public DriftResult compareOnly(Consumer<String> progress) throws TaskFailedException {
        progress.accept("Collecting current HWID...");
        Snapshot snap = collectOrFail();

        progress.accept("Comparing with previous report...");
        lock.lock();
        try {
            DriftResult drift = compareAndRecord(snap);
            if (drift.status() == DriftStatus.NO_BASELINE && settings.autoSaveReports()) {
                if (!reports.save(snap)) log.warn("[Pipeline] 기준 리포트 저장 실패");
            }
            return drift;
        } finally {
            lock.unlock();
        }
    }

    /** 새로 수집한 지문을 current 로 저장하고 차단 목록에 추가 */
    public BanCurrentOutcome banCurrent(Consumer<String> progress) throws TaskFailedException {
        progress.accept("Performing live scan to get current HWID...");
        Snapshot snap = collectOrFail();

        lock.lock();
        try {
            progress.accept("Saving HWID report...");
            if (!reports.save(snap)) throw new TaskFailedException(MSG_SAVE_FAILED);

            progress.accept("Adding HWID to ban list...");
            Fingerprint fp = reports.generateFingerprint(snap);
            BanResult r = bans.ban(fp);
            return new BanCurrentOutcome(fp, r.ok(), r.message());
        } finally {
            lock.unlock();
        }
    }

    /** 매번 새로 수집 (저장된 current 리포트는 보지 않음) */
    public AntiCheatVerdict antiCheatCheck(Consumer<String> progress) throws TaskFailedException {
        progress.accept("Initializing anti-cheat system...");
        progress.accept("Scanning hardware fingerprint...");
        Snapshot snap = collectOrFail();

        progress.accept("Generating hardware fingerprint...");
        Fingerprint fp = reports.generateFingerprint(snap);

        progress.accept("Checking against ban database...");
        BanResult check;
        lock.lock();
        try {
            check = bans.check(fp);
        } finally {
            lock.unlock();
        }

        progress.accept("Finalizing anti-cheat verification...");
        if (check.ok()) log.warn("[Pipeline] 안티치트: 차단된 하드웨어 {}", fp.shortForm());
        return new AntiCheatVerdict(check.ok(), fp, AntiCheatVerdict.FRESH_SCAN, check.message());
    }

    /**
     * 백그라운드 모니터 1회분. 변경 감지 또는 첫 기록이면 저장.
     * @throws TaskFailedException 수집 실패
     */
    public DriftResult monitorPass() throws TaskFailedException {
        Snapshot snap = collectOrFail();
        lock.lock();
        try {
            DriftResult drift = compareAndRecord(snap);
            switch (drift.status()) {
                case CHANGED -> {
                    log.warn("[Monitor] 정기 점검에서 HWID 변경 감지: {}", drift.message());
                    saveOrWarn(snap);
                }
                case NO_BASELINE -> {
                    log.info("[Monitor] 정기 점검: 첫 HWID 기록");
                    saveOrWarn(snap);
                }
                case UNCHANGED -> log.info("[Monitor] 정기 점검: 변경 없음");
            }
            return drift;
        } finally {
            lock.unlock();
        }
    }

    public StatsView statsView() {
        return stats.view();
    }

    /** 현재 저장된 리포트의 지문 (상태 조회용) */
    public Optional<Fingerprint> currentFingerprint() {
        return reports.loadCurrent().map(r -> r.fingerprint());
    }

    private DriftResult compareAndRecord(Snapshot snap) {
        DriftResult drift = reports.compare(snap);
        if (settings.statsTracking()) {
            stats.recordCheck(drift.current(), drift.status() == DriftStatus.CHANGED);
        }
        return drift;
    }

    private void saveOrWarn(Snapshot snap) {
        if (!reports.save(snap)) log.warn("[Monitor] 리포트 저장 실패, 다음 점검 때 재시도");
    }

    /**
     * 식별 필드가 하나도 없는 스냅샷(지문 INVALID)도 수집 실패로 본다.
     * 비교/통계/저장 어디에도 흘려보내지 않아 기존 기준 리포트가 유지됨.
     */
    private Snapshot collectOrFail() throws TaskFailedException {
        Optional<Snapshot> snap = collector.collect();
        if (snap.isEmpty() || snap.get().isEmpty()) {
            log.warn("[Pipeline] 하드웨어 정보 수집 실패");
            throw new TaskFailedException(MSG_COLLECT_FAILED);
        }
        if (!reports.generateFingerprint(snap.get()).valid()) {
            log.warn("[Pipeline] 식별 필드(디스크/BIOS/메인보드/UUID) 수집 실패");
            throw new TaskFailedException(MSG_COLLECT_FAILED);
        }
        return snap.get();
    }
}
