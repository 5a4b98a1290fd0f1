package com.airoom.hwidagent.task;

import com.airoom.hwidagent.fingerprint.Fingerprint;

/** 안티치트 검사 결과. 항상 새로 수집한 스냅샷 기준 (scanType = fresh_scan) */
public record AntiCheatVerdict(boolean banned, Fingerprint fingerprint, String scanType, String message) {

    public static final String FRESH_SCAN = "fresh_scan";
}
