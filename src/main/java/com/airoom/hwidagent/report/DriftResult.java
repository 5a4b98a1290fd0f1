package com.airoom.hwidagent.report;

import com.airoom.hwidagent.fingerprint.Fingerprint;

/**
 * 비교 결과.
 * @param previous NO_BASELINE 이면 null
 */
public record DriftResult(DriftStatus status, String message, Fingerprint previous, Fingerprint current) {

    public boolean changed() {
        return status == DriftStatus.CHANGED;
    }
}
