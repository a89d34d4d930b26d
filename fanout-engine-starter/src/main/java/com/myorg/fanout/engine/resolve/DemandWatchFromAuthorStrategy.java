package com.myorg.fanout.engine.resolve;

import com.myorg.fanout.contracts.model.Event;
import com.myorg.fanout.contracts.model.SubscriptionStyle;
import com.myorg.fanout.contracts.publish.PublishOptions;
import com.myorg.fanout.contracts.publish.ResolutionMethod;
import com.myorg.fanout.engine.store.DocumentQuery;

import java.util.Optional;

// The target author's own watch on the target.
public class DemandWatchFromAuthorStrategy implements ResolutionStrategy {

    @Override
    public ResolutionMethod method() {
        return ResolutionMethod.DEMAND_WATCH_SUBSCRIPTION_FROM_AUTHOR;
    }

    @Override
    public Optional<DocumentQuery> query(Event event, PublishOptions options) {
        if (!SubscriptionQueries.present(event.getTargetId())
                || !SubscriptionQueries.present(event.getTargetAuthorId())) {
            return Optional.empty();
        }
        return Optional.of(SubscriptionQueries.active(event.getTargetId(), SubscriptionStyle.WATCH)
                .and("subscriberId", event.getTargetAuthorId()));
    }
}
