package com.airoom.hwidagent.task;

/** 핸들러가 정상적으로 끝낼 수 없는 경우. 메시지가 그대로 ERROR 결과의 errorMessage 가 됨 */
public class TaskFailedException extends Exception {

    public TaskFailedException(String message) {
        super(message);
    }
}
