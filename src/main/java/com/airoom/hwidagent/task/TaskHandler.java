package com.airoom.hwidagent.task;

import java.util.function.Consumer;

/** 작업 종류별 처리. 워커 스레드에서 동기 실행되며 반환값이 SUCCESS 결과의 payload */
@FunctionalInterface
public interface TaskHandler {

    Object handle(TaskKind kind, Consumer<String> progress) throws TaskFailedException;
}
