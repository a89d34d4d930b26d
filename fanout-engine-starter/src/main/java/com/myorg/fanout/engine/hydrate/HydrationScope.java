package com.myorg.fanout.engine.hydrate;

/**
 * Where an entity sits in the event being hydrated. Decides what an access denial rejects.
 */
public enum HydrationScope {
    /** The event's own action, or its target. A denial rejects the whole event. */
    EVENT,
    /** A member of a child collection. A denial rejects only the item. */
    ITEM
}
