package com.myorg.fanout.contracts.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

/**
 * Recipient profile as produced by the join helper. Only the fields needed for notification
 * routing are mapped; everything else in the member document is ignored.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Member {
    private String id;
    private String displayName;
    private String username;
    private String gravatar;
    private String primaryEmail;
    private MemberConfig config;

    public boolean hasUsableEmail() {
        return primaryEmail != null && !primaryEmail.isBlank();
    }

    public boolean emailEnabledFor(String channel) {
        return config != null && config.emailEnabledFor(channel);
    }
}
