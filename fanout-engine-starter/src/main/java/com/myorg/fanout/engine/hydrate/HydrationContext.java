package com.myorg.fanout.engine.hydrate;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one hydration run: the event view being built, who is looking, and what got rejected.
 */
@Slf4j
public class HydrationContext {

    @Getter
    private final ObjectNode view;
    @Getter
    private final String requesterId;
    @Getter
    private final boolean authorize;

    private final HydratorRegistry registry;
    private final AtomicBoolean eventRejected = new AtomicBoolean();
    private final Set<ObjectNode> rejectedItems = Collections.synchronizedSet(
            Collections.newSetFromMap(new IdentityHashMap<>()));

    public HydrationContext(ObjectNode view, String requesterId, boolean authorize, HydratorRegistry registry) {
        this.view = view;
        this.requesterId = requesterId;
        this.authorize = authorize;
        this.registry = registry;
    }

    public void reject(ObjectNode entity, HydrationScope scope) {
        if (scope == HydrationScope.EVENT) {
            rejectEvent();
        } else {
            rejectedItems.add(entity);
        }
    }

    public void rejectEvent() {
        eventRejected.set(true);
    }

    public boolean isEventRejected() {
        return eventRejected.get();
    }

    public boolean isRejected(ObjectNode item) {
        return rejectedItems.contains(item);
    }

    /**
     * Hydrates a nested entity with the hydrator registered for its type.
     */
    public CompletableFuture<Void> descend(String actionType, ObjectNode entity, HydrationScope scope) {
        VariantHydrator hydrator = registry.get(actionType);
        if (hydrator == null) {
            log.debug("No hydrator for actionType={}, left as loaded", actionType);
            return CompletableFuture.completedFuture(null);
        }
        return hydrator.hydrate(this, entity, scope);
    }
}
