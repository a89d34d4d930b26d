package com.myorg.fanout.engine.access;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decides whether a requester may see a resource.
 */
@FunctionalInterface
public interface AccessPredicate {

    /**
     * @param requesterId member id, or null for an anonymous requester
     * @param resource    the resource document, never null
     */
    boolean canAccess(String requesterId, JsonNode resource);
}
