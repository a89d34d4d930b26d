package com.myorg.fanout.engine.resolve;

import com.myorg.fanout.contracts.model.Event;
import com.myorg.fanout.contracts.publish.PublishOptions;
import com.myorg.fanout.contracts.publish.ResolutionMethod;
import com.myorg.fanout.engine.store.DocumentQuery;

import java.util.Optional;

public class WithSubscriptionStrategy implements ResolutionStrategy {

    @Override
    public ResolutionMethod method() {
        return ResolutionMethod.WITH_SUBSCRIPTION;
    }

    @Override
    public Optional<DocumentQuery> query(Event event, PublishOptions options) {
        if (options == null || !SubscriptionQueries.present(options.getSubscriptionId())) return Optional.empty();
        return Optional.of(DocumentQuery.byId(options.getSubscriptionId()));
    }
}
