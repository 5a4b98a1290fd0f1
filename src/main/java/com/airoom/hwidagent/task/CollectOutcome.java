package com.airoom.hwidagent.task;

import com.airoom.hwidagent.device.Snapshot;
import com.airoom.hwidagent.fingerprint.Fingerprint;

/** collect 결과. saved=false 면 자동 저장이 꺼져 있거나 저장 실패 */
public record CollectOutcome(Snapshot snapshot, Fingerprint fingerprint, boolean saved) {}
