package com.componentwatch.monitor.digest;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class NoRunReportException extends RuntimeException {
    public NoRunReportException(String message) {
        super(message);
    }
}
