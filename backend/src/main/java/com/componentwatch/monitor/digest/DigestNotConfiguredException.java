package com.componentwatch.monitor.digest;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class DigestNotConfiguredException extends RuntimeException {
    public DigestNotConfiguredException(String message) {
        super(message);
    }
}
