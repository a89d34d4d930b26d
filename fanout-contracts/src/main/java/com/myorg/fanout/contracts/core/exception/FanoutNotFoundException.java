package com.myorg.fanout.contracts.core.exception;

public class FanoutNotFoundException extends FanoutException {
    public FanoutNotFoundException(String collection, String id) {
        super("NOT_FOUND", "No document in " + collection + " matched id=" + id);
    }
}
