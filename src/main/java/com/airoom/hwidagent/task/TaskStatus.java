package com.airoom.hwidagent.task;

public enum TaskStatus {
    SUCCESS,
    ERROR
}
