package com.myorg.fanout.engine.join;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Projection used when joining a referenced document: which collection to read and which fields
 * to keep. An empty field set keeps the whole document. {@code id} is always kept.
 */
public record Profile(String collection, Set<String> fields) {

    public Profile {
        fields = Set.copyOf(fields);
    }

    public static Profile all(String collection) {
        return new Profile(collection, Set.of());
    }

    public static Profile of(String collection, String... fields) {
        return new Profile(collection, Set.of(fields));
    }

    public boolean keepsAll() {
        return fields.isEmpty();
    }

    public Profile with(String... extra) {
        Set<String> merged = new LinkedHashSet<>(fields);
        merged.addAll(Set.of(extra));
        return new Profile(collection, merged);
    }
}
