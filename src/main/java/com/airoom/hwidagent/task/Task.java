package com.airoom.hwidagent.task;

import java.time.Instant;
import java.util.Objects;

/**
 * 큐에 들어가는 작업 1건.
 * kind 는 제출된 문자열 그대로 보관 (알 수 없는 종류도 결과로 돌려줘야 하므로)
 */
public record Task(String kind, String id, Instant submittedAt) {

    public Task {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(submittedAt, "submittedAt");
    }
}
