package com.myorg.fanout.contracts.publish;

/**
 * How the subscriptions interested in an event are found.
 */
public enum ResolutionMethod {
    /** Followers of the actor, plus watchers of the target when the event has one. */
    DEMAND_SUBSCRIPTION,
    /** Watchers of the target, each re-checked against the access predicate. */
    DEMAND_WATCH_SUBSCRIPTION,
    /** The target author's own watch subscription on the target. */
    DEMAND_WATCH_SUBSCRIPTION_FROM_AUTHOR,
    /** Exactly the subscription named in {@link PublishOptions#getSubscriptionId()}. */
    WITH_SUBSCRIPTION
}
