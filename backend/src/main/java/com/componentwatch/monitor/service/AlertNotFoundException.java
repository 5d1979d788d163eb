package com.componentwatch.monitor.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class AlertNotFoundException extends RuntimeException {
    public AlertNotFoundException(long id) {
        super("Alert " + id + " not found");
    }
}
