package com.airoom.hwidagent.stats;

/** @param changeRate changes / checks × 100, 소수 둘째 자리 반올림 (checks=0 이면 0) */
public record MonthlySummary(long checks, long changes, int uniqueFingerprints, double changeRate) {}
