package com.airoom.hwidagent.task;

import java.util.Objects;

/**
 * 작업 결과. id 로 제출한 Task 와 1:1 대응.
 * SUCCESS 면 payload, ERROR 면 errorMessage 만 채워짐.
 */
public record TaskResult(String id, TaskStatus status, Object payload, String errorMessage) {

    public TaskResult {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
    }

    public static TaskResult success(String id, Object payload) {
        return new TaskResult(id, TaskStatus.SUCCESS, payload, null);
    }

    public static TaskResult error(String id, String message) {
        return new TaskResult(id, TaskStatus.ERROR, null, message);
    }

    public boolean isSuccess() {
        return status == TaskStatus.SUCCESS;
    }

    /** payload 를 기대 타입으로 꺼냄 (타입이 다르면 ClassCastException) */
    public <T> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}
