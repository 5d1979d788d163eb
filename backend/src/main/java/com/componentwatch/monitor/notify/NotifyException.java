package com.componentwatch.monitor.notify;

/**
 * Webhook delivery failed. {@code statusCode} is the HTTP status of the webhook response, or
 * {@code 0} when no response was received.
 */
public class NotifyException extends RuntimeException {
    private final int statusCode;

    public NotifyException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public NotifyException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
