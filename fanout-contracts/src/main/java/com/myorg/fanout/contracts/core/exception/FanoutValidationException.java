package com.myorg.fanout.contracts.core.exception;

// Rejected before any side effect (missing channel/topic/data, wrong subscription state).
public class FanoutValidationException extends FanoutException {
    public FanoutValidationException(String message) {
        super("INVALID_DATA", message);
    }
}
