package com.airoom.hwidagent.ban;

/**
 * ban/unban/check 결과. 실패 사유(이미 차단됨, 차단 안 됨 등)는 예외 대신 ok=false 로 전달.
 * check 에서는 ok 가 "차단됨" 을 뜻함.
 */
public record BanResult(boolean ok, String message) {}
