package com.componentwatch.monitor.model;

public enum RunPhase {
    IDLE,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isActive() {
        return this == RUNNING;
    }
}
