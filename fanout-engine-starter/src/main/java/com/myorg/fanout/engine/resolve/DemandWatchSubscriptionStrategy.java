package com.myorg.fanout.engine.resolve;

import com.myorg.fanout.contracts.model.Event;
import com.myorg.fanout.contracts.model.SubscriptionStyle;
import com.myorg.fanout.contracts.publish.PublishOptions;
import com.myorg.fanout.contracts.publish.ResolutionMethod;
import com.myorg.fanout.engine.store.DocumentQuery;

import java.util.Optional;

// Watchers of the target who can still see it.
public class DemandWatchSubscriptionStrategy implements ResolutionStrategy {

    @Override
    public ResolutionMethod method() {
        return ResolutionMethod.DEMAND_WATCH_SUBSCRIPTION;
    }

    @Override
    public Optional<DocumentQuery> query(Event event, PublishOptions options) {
        if (!SubscriptionQueries.present(event.getTargetId())) return Optional.empty();
        return Optional.of(SubscriptionQueries.active(event.getTargetId(), SubscriptionStyle.WATCH));
    }

    @Override
    public boolean recheckAccess() {
        return true;
    }
}
