package com.myorg.fanout.contracts.core.exception;

// Raised by subscription stores on a (subscriberId, subscribeeId) unique-key conflict.
public class DuplicateSubscriptionException extends FanoutException {
    public DuplicateSubscriptionException(String subscriberId, String subscribeeId, Throwable cause) {
        super("DUPLICATE_SUBSCRIPTION",
                "Subscription already exists subscriberId=" + subscriberId + ", subscribeeId=" + subscribeeId,
                cause);
    }
}
