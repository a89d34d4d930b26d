package com.myorg.fanout.contracts.model;

import lombok.*;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {
    private String id;
    private String subscriberId;
    private String subscribeeId;
    private SubscriptionMeta meta;
    private boolean mute;

    public SubscriptionStyle style() {
        return meta == null ? null : meta.getStyle();
    }
}
