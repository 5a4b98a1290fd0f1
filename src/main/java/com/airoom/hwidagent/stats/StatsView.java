package com.airoom.hwidagent.stats;

import java.util.List;
import java.util.SortedMap;

/** fetchStats 결과. 호출 시점의 복사본이라 이후 기록과 무관 */
public record StatsView(
        long totalChecks,
        long totalChanges,
        int uniqueFingerprints,
        String firstCheck,
        String lastCheck,
        String lastChange,
        double changesPerMonth,
        double changeRate,
        SortedMap<String, MonthlySummary> monthly,
        List<ChangeEvent> recentChanges
) {}
