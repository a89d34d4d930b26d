package com.myorg.fanout.contracts.core.exception;

public class FanoutException extends RuntimeException {

    private final String reason;

    public FanoutException(String message) {
        this("FANOUT_ERROR", message);
    }

    public FanoutException(String reason, String message) {
        this(reason, message, null);
    }

    public FanoutException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null || reason.isBlank()) ? "FANOUT_ERROR" : reason;
    }

    public String getReason() {
        return reason;
    }
}
