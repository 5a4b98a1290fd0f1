package com.airoom.hwidagent.task;

import java.util.Optional;

/** 워커가 처리하는 작업 종류. wireName 은 HTTP/문자열 제출에 쓰는 이름 */
public enum TaskKind {
    COLLECT("collect"),
    COMPARE_ONLY("compareOnly"),
    BAN_CURRENT("banCurrent"),
    RUN_ANTI_CHEAT_CHECK("runAntiCheatCheck"),
    FETCH_STATS("fetchStats");

    private final String wireName;

    TaskKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** wireName 또는 enum 상수 이름(대소문자 무시) */
    public static Optional<TaskKind> fromName(String name) {
        if (name == null) return Optional.empty();
        for (TaskKind k : values()) {
            if (k.wireName.equals(name) || k.name().equalsIgnoreCase(name)) return Optional.of(k);
        }
        return Optional.empty();
    }
}
