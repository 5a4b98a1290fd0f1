package com.airoom.hwidagent.task;

import com.airoom.hwidagent.fingerprint.Fingerprint;

/** banCurrent 결과. 이미 차단된 지문이면 banned=false + 사유 메시지 */
public record BanCurrentOutcome(Fingerprint fingerprint, boolean banned, String message) {}
