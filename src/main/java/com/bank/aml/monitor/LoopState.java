package com.bank.aml.monitor;

public enum LoopState {
    IDLE,
    RUNNING_PASS,
    SLEEPING,
    SHUTTING_DOWN,
    STOPPED
}
