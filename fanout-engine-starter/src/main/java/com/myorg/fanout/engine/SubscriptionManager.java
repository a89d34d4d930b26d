package com.myorg.fanout.engine;

import com.myorg.fanout.contracts.model.Subscription;
import com.myorg.fanout.contracts.model.SubscriptionMeta;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public interface SubscriptionManager {

    /**
     * Creates the subscription and announces it. A duplicate pair completes with the existing
     * subscription and publishes nothing.
     */
    CompletableFuture<Subscription> subscribe(String subscriberId, String subscribeeId, SubscriptionMeta meta);

    /**
     * @return the removed subscription, or empty when there was nothing to remove
     */
    CompletableFuture<Optional<Subscription>> unsubscribe(String subscriberId, String subscribeeId);

    /**
     * Turns a pending request into a follow.
     */
    CompletableFuture<Subscription> accept(Subscription subscription);
}
