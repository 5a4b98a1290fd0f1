package com.airoom.hwidagent.monitor;

import java.time.Instant;

/**
 * @param lastCheck   마지막 점검 시각 (아직 없으면 null)
 * @param lastOutcome 마지막 점검 결과 요약 (DriftStatus 이름 또는 오류 메시지)
 * @param passes      시작 이후 완료된 점검 횟수
 */
public record MonitoringStatus(boolean active, Instant lastCheck, String lastOutcome, long passes) {}
