package com.airoom.hwidagent.stats;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * hwid_stats.json 의 저장 형태 (Gson 이 그대로 직렬화).
 * 시각은 로컬 ISO-8601 문자열, 일/월 버킷 키는 yyyy-MM-dd / yyyy-MM.
 * StatsTracker 밖에서는 {@link #copy()} 로만 넘긴다.
 */
public class HwidStats {

    long totalChecks;
    long totalChanges;
    String firstCheck;
    String lastCheck;
    String lastChange;
    List<ChangeEvent> changeHistory = new ArrayList<>();
    TreeMap<String, MonthlyStats> monthlyStats = new TreeMap<>();
    TreeMap<String, Long> dailyChecks = new TreeMap<>();
    // 처음 본 순서 유지, 재관측 시 뒤로 이동 (보존 상한 정리 기준)
    LinkedHashSet<String> fingerprints = new LinkedHashSet<>();

    public static class MonthlyStats {
        long checks;
        long changes;
        Set<String> uniqueFingerprints = new LinkedHashSet<>();

        public long getChecks() { return checks; }
        public long getChanges() { return changes; }
        public Set<String> getUniqueFingerprints() { return Set.copyOf(uniqueFingerprints); }

        MonthlyStats copy() {
            MonthlyStats m = new MonthlyStats();
            m.checks = checks;
            m.changes = changes;
            m.uniqueFingerprints = new LinkedHashSet<>(uniqueFingerprints);
            return m;
        }
    }

    public long getTotalChecks() { return totalChecks; }
    public long getTotalChanges() { return totalChanges; }
    public String getFirstCheck() { return firstCheck; }
    public String getLastCheck() { return lastCheck; }
    public String getLastChange() { return lastChange; }
    public List<ChangeEvent> getChangeHistory() { return List.copyOf(changeHistory); }
    public TreeMap<String, MonthlyStats> getMonthlyStats() { return monthlyStats; }
    public TreeMap<String, Long> getDailyChecks() { return dailyChecks; }
    public Set<String> getFingerprints() { return Set.copyOf(fingerprints); }

    /** 이전 버전 파일에 없는 필드는 null 로 읽히므로 채워 넣음 */
    void fillDefaults() {
        if (changeHistory == null) changeHistory = new ArrayList<>();
        if (monthlyStats == null) monthlyStats = new TreeMap<>();
        if (dailyChecks == null) dailyChecks = new TreeMap<>();
        if (fingerprints == null) fingerprints = new LinkedHashSet<>();
        for (MonthlyStats m : monthlyStats.values()) {
            if (m.uniqueFingerprints == null) m.uniqueFingerprints = new LinkedHashSet<>();
        }
    }

    public HwidStats copy() {
        HwidStats c = new HwidStats();
        c.totalChecks = totalChecks;
        c.totalChanges = totalChanges;
        c.firstCheck = firstCheck;
        c.lastCheck = lastCheck;
        c.lastChange = lastChange;
        c.changeHistory = new ArrayList<>(changeHistory);
        monthlyStats.forEach((k, v) -> c.monthlyStats.put(k, v.copy()));
        c.dailyChecks = new TreeMap<>(dailyChecks);
        c.fingerprints = new LinkedHashSet<>(fingerprints);
        return c;
    }
}
