package com.airoom.hwidagent.report;

import com.airoom.hwidagent.config.SettingsStore;
import com.airoom.hwidagent.device.Snapshot;
import com.airoom.hwidagent.fingerprint.Fingerprint;
import com.airoom.hwidagent.fingerprint.FingerprintEngine;
import com.airoom.hwidagent.store.HwidDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * current 리포트 1건 + 이력(backupReports=true 일 때, maxReports 상한) 관리와 드리프트 비교.
 *
 * 스레드-세이프: 메서드 단위 synchronized.
 * "읽기 → 비교 → 조건부 저장" 같은 여러 호출 묶음은 호출 측(DriftPipeline)의 락으로 보호한다.
 */
public class ReportStore {

    private static final Logger log = LoggerFactory.getLogger(ReportStore.class);

    public static final String MSG_NO_BASELINE = "No previous report found";
    public static final String MSG_UNCHANGED = "HWID matches previous report";
    public static final String MSG_CHANGED = "HWID has changed from previous report";

    private final HwidDataStore store;
    private final SettingsStore settings;
    private final Clock clock;

    public ReportStore(HwidDataStore store, SettingsStore settings) {
        this(store, settings, Clock.systemUTC());
    }

    public ReportStore(HwidDataStore store, SettingsStore settings, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Fingerprint generateFingerprint(Snapshot snapshot) {
        return FingerprintEngine.compute(snapshot);
    }

    /**
     * current 를 덮어쓰고, 이력 보관이 켜져 있으면 이력 추가 후 상한 초과분 정리.
     * @return 실패 시 false (예외 없음). false 면 "저장 안 됨, 재시도 필요"로 취급할 것
     */
    public synchronized boolean save(Snapshot snapshot) {
        Report report = new Report(snapshot, generateFingerprint(snapshot), clock.instant());
        try {
            store.writeCurrentReport(report);
        } catch (IOException | RuntimeException e) {
            log.error("[ReportStore] 리포트 저장 실패: {}", e.getMessage());
            return false;
        }

        if (settings.backupReports()) {
            try {
                store.appendHistory(report);
                store.pruneHistory(settings.maxReports());
            } catch (IOException | RuntimeException e) {
                // current 는 이미 반영됨. 이력만 누락 → 다음 저장 때 다시 정리됨
                log.error("[ReportStore] 이력 리포트 저장/정리 실패: {}", e.getMessage());
                return false;
            }
        }
        log.info("[ReportStore] 리포트 저장: {}", report.fingerprint().shortForm());
        return true;
    }

    public synchronized Optional<Report> loadCurrent() {
        try {
            return store.loadCurrentReport();
        } catch (IOException | RuntimeException e) {
            log.error("[ReportStore] current 리포트 읽기 실패: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public synchronized DriftResult compare(Snapshot newSnapshot) {
        Fingerprint current = generateFingerprint(newSnapshot);
        Optional<Report> prev = loadCurrent();
        if (prev.isEmpty()) {
            log.info("[ReportStore] 비교할 이전 리포트 없음");
            return new DriftResult(DriftStatus.NO_BASELINE, MSG_NO_BASELINE, null, current);
        }

        Fingerprint previous = prev.get().fingerprint();
        if (previous.equals(current)) {
            log.info("[ReportStore] 비교 결과: 변경 없음");
            return new DriftResult(DriftStatus.UNCHANGED, MSG_UNCHANGED, previous, current);
        }
        log.warn("[ReportStore] 비교 결과: 하드웨어 변경 감지 {} -> {}", previous.shortForm(), current.shortForm());
        return new DriftResult(DriftStatus.CHANGED, MSG_CHANGED, previous, current);
    }

    /** 이력 리포트 최신순 (읽기 실패 시 빈 목록) */
    public synchronized List<Report> history() {
        try {
            return store.listHistory();
        } catch (IOException | RuntimeException e) {
            log.error("[ReportStore] 이력 조회 실패: {}", e.getMessage());
            return List.of();
        }
    }
}
