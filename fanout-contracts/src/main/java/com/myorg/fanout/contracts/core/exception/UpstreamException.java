package com.myorg.fanout.contracts.core.exception;

/**
 * Failure of an external collaborator (store, join helper, access predicate, transport).
 * Propagated to the caller and aborts the remaining stages of the current operation.
 */
public class UpstreamException extends FanoutException {
    public UpstreamException(String message, Throwable cause) {
        super("UPSTREAM", message, cause);
    }
}
