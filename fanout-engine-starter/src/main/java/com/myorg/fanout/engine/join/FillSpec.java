package com.myorg.fanout.engine.join;

import com.myorg.fanout.engine.store.ListOptions;

import java.util.Map;

/**
 * Describes a child collection to attach to parent documents: children whose {@code foreignKey}
 * equals the parent id are listed with {@code options}, optionally inflated, and stored on the
 * parent under {@code as}.
 */
public record FillSpec(String collection, String foreignKey, String as,
                       ListOptions options, Map<String, Profile> inflate) {

    public static FillSpec of(String collection, String foreignKey) {
        return new FillSpec(collection, foreignKey, collection, ListOptions.none(), Map.of());
    }

    public FillSpec sortedBy(String field, int direction) {
        return new FillSpec(collection, foreignKey, as, ListOptions.sortBy(field, direction), inflate);
    }

    public FillSpec limit(int max) {
        return new FillSpec(collection, foreignKey, as, options.limit(max), inflate);
    }

    public FillSpec reversed() {
        return new FillSpec(collection, foreignKey, as, options.reversed(), inflate);
    }

    public FillSpec inflating(Map<String, Profile> references) {
        return new FillSpec(collection, foreignKey, as, options, Map.copyOf(references));
    }
}
