package com.myorg.fanout.contracts.core.exception;

public class UnknownResolutionMethodException extends FanoutException {
    public UnknownResolutionMethodException(Object method) {
        super("UNKNOWN_RESOLUTION_METHOD", "No resolution strategy registered for method=" + method);
    }
}
