package com.myorg.fanout.engine.resolve;

import com.myorg.fanout.contracts.model.Event;
import com.myorg.fanout.contracts.model.SubscriptionStyle;
import com.myorg.fanout.contracts.publish.PublishOptions;
import com.myorg.fanout.contracts.publish.ResolutionMethod;
import com.myorg.fanout.engine.store.DocumentQuery;

import java.util.Optional;

// Followers of the actor, plus watchers of the target.
public class DemandSubscriptionStrategy implements ResolutionStrategy {

    @Override
    public ResolutionMethod method() {
        return ResolutionMethod.DEMAND_SUBSCRIPTION;
    }

    @Override
    public Optional<DocumentQuery> query(Event event, PublishOptions options) {
        if (!SubscriptionQueries.present(event.getActorId())) return Optional.empty();
        DocumentQuery followers = SubscriptionQueries.active(event.getActorId(), SubscriptionStyle.FOLLOW);
        if (!SubscriptionQueries.present(event.getTargetId())) return Optional.of(followers);
        return Optional.of(DocumentQuery.anyOf(followers,
                SubscriptionQueries.active(event.getTargetId(), SubscriptionStyle.WATCH)));
    }
}
