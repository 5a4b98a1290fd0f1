package com.airoom.hwidagent.fingerprint;

import java.util.Objects;

/**
 * 하드웨어 지문.
 * 식별 필드가 하나도 없으면 {@link #INVALID} (빈 문자열 해시를 정상 지문처럼 쓰지 않음).
 */
public record Fingerprint(String hash, boolean valid) {

    public static final Fingerprint INVALID = new Fingerprint("invalid", false);

    public Fingerprint {
        Objects.requireNonNull(hash, "hash");
    }

    public static Fingerprint of(String hash) {
        return new Fingerprint(hash, true);
    }

    /** 로그/메시지용 축약 표기 (앞 8자...) */
    public String shortForm() {
        if (!valid) return hash;
        return hash.length() <= 8 ? hash : hash.substring(0, 8) + "...";
    }

    @Override
    public String toString() {
        return hash;
    }
}
