package com.componentwatch.monitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TargetStatus {
    @JsonProperty("success")
    SUCCESS,
    @JsonProperty("failed")
    FAILED;

    public String label() {
        return this == SUCCESS ? "success" : "failed";
    }
}
