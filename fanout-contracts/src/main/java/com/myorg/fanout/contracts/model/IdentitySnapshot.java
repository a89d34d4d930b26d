package com.myorg.fanout.contracts.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Compact identity of one party of a social event, as rendered by clients.
 *
 * <p>Wire keys are kept short: {@code i}=id, {@code a}=display name, {@code g}=gravatar hash,
 * {@code t}=action type, {@code s}=username (slug). Target snapshots carry only {@code i, a, s}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IdentitySnapshot(
        @JsonProperty("i") String id,
        @JsonProperty("a") String displayName,
        @JsonProperty("g") String gravatar,
        @JsonProperty("t") String type,
        @JsonProperty("s") String username
) {
    public static IdentitySnapshot actor(String id, String displayName, String gravatar, String type, String username) {
        return new IdentitySnapshot(id, displayName, gravatar, type, username);
    }

    public static IdentitySnapshot target(String id, String displayName, String username) {
        return new IdentitySnapshot(id, displayName, null, null, username);
    }
}
