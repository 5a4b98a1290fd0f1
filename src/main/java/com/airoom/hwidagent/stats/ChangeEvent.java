package com.airoom.hwidagent.stats;

/** 변경 감지 1건. checkNumber = 감지 시점의 totalChecks */
public record ChangeEvent(String timestamp, String fingerprint, long checkNumber) {}
