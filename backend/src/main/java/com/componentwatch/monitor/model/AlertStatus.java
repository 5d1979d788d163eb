package com.componentwatch.monitor.model;

public enum AlertStatus {
    MISSING_COMPONENT,
    ERROR
}
