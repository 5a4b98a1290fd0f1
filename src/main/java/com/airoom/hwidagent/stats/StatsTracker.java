package com.airoom.hwidagent.stats;

import com.airoom.hwidagent.config.SettingsStore;
import com.airoom.hwidagent.fingerprint.Fingerprint;
import com.airoom.hwidagent.store.HwidDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 검사/변경 횟수 집계 (hwid_stats.json).
 * 카운터는 증가만 함. 보존 상한 정리는 이벤트 로그/지문 목록/일별 버킷에만 적용.
 */
public class StatsTracker {

    private static final Logger log = LoggerFactory.getLogger(StatsTracker.class);

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final int RECENT_CHANGES = 5;

    private final HwidDataStore store;
    private final SettingsStore settings;
    private final Clock clock;
    private final HwidStats stats;

    public StatsTracker(HwidDataStore store, SettingsStore settings) {
        this(store, settings, Clock.systemDefaultZone());
    }

    public StatsTracker(HwidDataStore store, SettingsStore settings, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stats = loadOrNew(store);
    }

    private static HwidStats loadOrNew(HwidDataStore store) {
        try {
            Optional<HwidStats> loaded = store.loadStats();
            if (loaded.isPresent()) {
                HwidStats s = loaded.get();
                s.fillDefaults();
                log.info("[Stats] 통계 로드: 검사 {}회, 변경 {}회", s.totalChecks, s.totalChanges);
                return s;
            }
        } catch (IOException e) {
            log.error("[Stats] 통계 파일 읽기 실패, 새로 시작: {}", e.getMessage());
        }
        return new HwidStats();
    }

    public synchronized void recordCheck(Fingerprint fingerprint, boolean changed) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        String timestamp = now.toString();
        String hash = fingerprint.hash();

        stats.totalChecks++;
        stats.lastCheck = timestamp;
        if (stats.firstCheck == null) stats.firstCheck = timestamp;

        stats.dailyChecks.merge(now.format(DAY), 1L, Long::sum);

        HwidStats.MonthlyStats month = stats.monthlyStats.computeIfAbsent(now.format(MONTH), k -> new HwidStats.MonthlyStats());
        month.checks++;
        month.uniqueFingerprints.add(hash);

        // 재관측이면 뒤로 이동 → 오래 안 보인 지문부터 정리됨
        stats.fingerprints.remove(hash);
        stats.fingerprints.add(hash);

        if (changed) {
            stats.totalChanges++;
            stats.lastChange = timestamp;
            month.changes++;
            stats.changeHistory.add(new ChangeEvent(timestamp, hash, stats.totalChecks));
            log.warn("[Stats] HWID 변경 기록. 누적 변경 {}회", stats.totalChanges);
        }

        applyRetention(now.toLocalDate());
        persist();
    }

    private void applyRetention(LocalDate today) {
        int maxEvents = settings.statsMaxChangeEvents();
        if (stats.changeHistory.size() > maxEvents) {
            stats.changeHistory = new ArrayList<>(
                    stats.changeHistory.subList(stats.changeHistory.size() - maxEvents, stats.changeHistory.size()));
        }

        int maxFingerprints = settings.statsMaxFingerprints();
        Iterator<String> it = stats.fingerprints.iterator();
        while (stats.fingerprints.size() > maxFingerprints && it.hasNext()) {
            it.next();
            it.remove();
        }

        String cutoff = today.minusDays(settings.statsDailyRetentionDays()).format(DAY);
        stats.dailyChecks.headMap(cutoff).clear();
    }

    private void persist() {
        try {
            store.writeStats(stats);
        } catch (IOException e) {
            // 메모리 값은 유지, 다음 기록 때 다시 저장 시도
            log.warn("[Stats] 통계 저장 실패: {}", e.getMessage());
        }
    }

    /** 월평균 변경 횟수. 기간이 한 달 미만이면 1개월로 계산 */
    public synchronized double changeFrequency() {
        if (stats.firstCheck == null || stats.totalChanges == 0) return 0;
        LocalDate first = LocalDateTime.parse(stats.firstCheck).toLocalDate();
        LocalDate last = LocalDateTime.parse(stats.lastCheck).toLocalDate();
        long months = (last.getYear() - first.getYear()) * 12L + (last.getMonthValue() - first.getMonthValue());
        return round2((double) stats.totalChanges / Math.max(1, months));
    }

    public synchronized TreeMap<String, MonthlySummary> monthlySummary() {
        TreeMap<String, MonthlySummary> out = new TreeMap<>();
        for (Map.Entry<String, HwidStats.MonthlyStats> e : stats.monthlyStats.entrySet()) {
            HwidStats.MonthlyStats m = e.getValue();
            double rate = m.checks > 0 ? round2(m.changes * 100.0 / m.checks) : 0;
            out.put(e.getKey(), new MonthlySummary(m.checks, m.changes, m.uniqueFingerprints.size(), rate));
        }
        return out;
    }

    public synchronized double overallChangeRate() {
        if (stats.totalChecks == 0) return 0;
        return round2(stats.totalChanges * 100.0 / stats.totalChecks);
    }

    public synchronized HwidStats snapshot() {
        return stats.copy();
    }

    public synchronized StatsView view() {
        List<ChangeEvent> recent = new ArrayList<>(stats.changeHistory);
        // 같은 초에 기록된 변경도 순서가 갈리도록 checkNumber 기준
        recent.sort(Comparator.comparingLong(ChangeEvent::checkNumber).reversed());
        if (recent.size() > RECENT_CHANGES) recent = new ArrayList<>(recent.subList(0, RECENT_CHANGES));
        return new StatsView(
                stats.totalChecks,
                stats.totalChanges,
                stats.fingerprints.size(),
                stats.firstCheck,
                stats.lastCheck,
                stats.lastChange,
                changeFrequency(),
                overallChangeRate(),
                monthlySummary(),
                List.copyOf(recent)
        );
    }

    private static double round2(double v) {
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
