package com.myorg.fanout.contracts.publish;

import lombok.*;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PublishOptions {
    // null -> fanout.engine.default-method
    private ResolutionMethod method;
    // only read by WITH_SUBSCRIPTION
    private String subscriptionId;

    public static PublishOptions withSubscription(String subscriptionId) {
        return new PublishOptions(ResolutionMethod.WITH_SUBSCRIPTION, subscriptionId);
    }

    public static PublishOptions method(ResolutionMethod method) {
        return new PublishOptions(method, null);
    }
}
