package com.myorg.fanout.engine.hydrate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.contracts.core.conventions.CollectionNames;
import com.myorg.fanout.engine.concurrent.FanoutFutures;
import com.myorg.fanout.engine.join.FillSpec;
import com.myorg.fanout.engine.join.Profile;
import com.myorg.fanout.engine.join.Profiles;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public abstract class AbstractVariantHydrator implements VariantHydrator {

    protected final HydrationSupport support;

    protected AbstractVariantHydrator(HydrationSupport support) {
        this.support = support;
    }

    protected CompletableFuture<Void> inflate(ObjectNode entity, Map<String, Profile> references) {
        return FanoutFutures.run(support.executor(), "inflate " + references.keySet(),
                () -> support.joiner().inflate(entity, references));
    }

    protected CompletableFuture<Void> author(ObjectNode entity) {
        return inflate(entity, Map.of("author", Profiles.MEMBER));
    }

    protected CompletableFuture<Void> fill(List<ObjectNode> parents, FillSpec spec) {
        return FanoutFutures.run(support.executor(), "fill " + spec.as(),
                () -> support.joiner().fill(parents, spec));
    }

    protected CompletableFuture<Void> fill(ObjectNode parent, FillSpec spec) {
        return fill(List.of(parent), spec);
    }

    // newest N, delivered oldest first
    protected FillSpec latest(String collection, String foreignKey) {
        return FillSpec.of(collection, foreignKey)
                .sortedBy("created", -1)
                .limit(support.commentLimit())
                .reversed()
                .inflating(Map.of("author", Profiles.MEMBER));
    }

    protected CompletableFuture<Void> latestComments(ObjectNode entity) {
        return fill(entity, latest(CollectionNames.COMMENTS, "parentId"));
    }

    protected CompletableFuture<Void> medias(ObjectNode entity) {
        return fill(entity, FillSpec.of(CollectionNames.MEDIAS, "parentId").sortedBy("created", -1));
    }

    protected CompletableFuture<Void> hangtens(ObjectNode entity) {
        return fill(entity, FillSpec.of(CollectionNames.HANGTENS, "parentId"));
    }

    /**
     * Runs the access predicate unless the context skips authorization.
     */
    protected CompletableFuture<Boolean> allowed(HydrationContext ctx, ObjectNode entity) {
        if (!ctx.isAuthorize()) return CompletableFuture.completedFuture(true);
        return FanoutFutures.supply(support.executor(), "access check",
                () -> support.access().canAccess(ctx.getRequesterId(), entity));
    }

    protected static List<ObjectNode> objects(JsonNode array) {
        List<ObjectNode> out = new ArrayList<>();
        if (array != null && array.isArray()) {
            array.forEach(n -> {
                if (n.isObject()) out.add((ObjectNode) n);
            });
        }
        return out;
    }
}
