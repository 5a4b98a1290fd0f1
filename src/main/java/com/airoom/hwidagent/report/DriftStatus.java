package com.airoom.hwidagent.report;

public enum DriftStatus {
    NO_BASELINE,   // 비교할 이전 리포트 없음 (첫 실행, 오류 아님)
    UNCHANGED,     // 지문 동일
    CHANGED        // 지문 변경 감지
}
