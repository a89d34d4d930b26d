package com.myorg.fanout.contracts.model;

import lombok.*;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionMeta {
    private String type;    // subscribee entity kind: member, crag, dataset...
    private SubscriptionStyle style;

    public static SubscriptionMeta of(String type, SubscriptionStyle style) {
        return new SubscriptionMeta(type, style);
    }
}
