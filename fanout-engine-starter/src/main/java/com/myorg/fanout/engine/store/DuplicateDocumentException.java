package com.myorg.fanout.engine.store;

import com.myorg.fanout.contracts.core.exception.FanoutException;

// Unique-key conflict reported by a DocumentStore, distinct from transport failures.
public class DuplicateDocumentException extends FanoutException {
    public DuplicateDocumentException(String collection, String key) {
        super("DUPLICATE_KEY", "Duplicate key in " + collection + ": " + key);
    }
}
