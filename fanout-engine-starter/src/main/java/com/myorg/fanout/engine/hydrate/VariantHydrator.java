package com.myorg.fanout.engine.hydrate;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.CompletableFuture;

/**
 * Rebuilds the client-facing view of one action type in place.
 */
public interface VariantHydrator {

    String actionType();

    CompletableFuture<Void> hydrate(HydrationContext ctx, ObjectNode entity, HydrationScope scope);
}
