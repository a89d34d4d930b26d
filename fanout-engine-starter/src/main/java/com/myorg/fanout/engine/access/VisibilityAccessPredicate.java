package com.myorg.fanout.engine.access;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Public resources are visible to everyone; a private resource only to its author, or to the
 * member it is.
 */
public class VisibilityAccessPredicate implements AccessPredicate {

    @Override
    public boolean canAccess(String requesterId, JsonNode resource) {
        if (resource == null) return false;
        JsonNode visibility = resource.get("public");
        boolean isPublic = visibility == null || visibility.isNull() || visibility.asBoolean(true);
        if (isPublic) return true;
        if (requesterId == null) return false;
        return requesterId.equals(resource.path("authorId").asText(null))
                || requesterId.equals(resource.path("author").path("id").asText(null))
                || requesterId.equals(resource.path("id").asText(null));
    }
}
