package com.myorg.fanout.engine.resolve;

import com.myorg.fanout.contracts.model.Event;
import com.myorg.fanout.contracts.publish.PublishOptions;
import com.myorg.fanout.contracts.publish.ResolutionMethod;
import com.myorg.fanout.engine.store.DocumentQuery;

import java.util.Optional;

/**
 * One way of finding the subscriptions interested in an event. The set of methods is fixed; an
 * application bean for a method takes the place of the built-in strategy for it.
 */
public interface ResolutionStrategy {

    ResolutionMethod method();

    /**
     * @return the subscription query, or empty when the event carries nothing to query on
     */
    Optional<DocumentQuery> query(Event event, PublishOptions options);

    /**
     * When true every candidate is re-checked against the access predicate using a fresh read of
     * the subscribee resource.
     */
    default boolean recheckAccess() {
        return false;
    }
}
