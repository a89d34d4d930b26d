package com.myorg.fanout.contracts.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MemberConfig {
    // keyed by publish channel (post, comment, follow...)
    private Map<String, ChannelPreference> notifications = new HashMap<>();

    public boolean emailEnabledFor(String channel) {
        if (notifications == null || channel == null) return false;
        ChannelPreference pref = notifications.get(channel);
        return pref != null && pref.isEmailEnabled();
    }
}
