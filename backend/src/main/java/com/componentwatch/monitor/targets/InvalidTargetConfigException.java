package com.componentwatch.monitor.targets;

public class InvalidTargetConfigException extends RuntimeException {
    public InvalidTargetConfigException(String message) {
        super(message);
    }

    public InvalidTargetConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
