package com.myorg.fanout.engine.hydrate.dataset;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.contracts.core.conventions.CollectionNames;
import com.myorg.fanout.engine.concurrent.FanoutFutures;
import com.myorg.fanout.engine.hydrate.AbstractVariantHydrator;
import com.myorg.fanout.engine.hydrate.HydrationContext;
import com.myorg.fanout.engine.hydrate.HydrationScope;
import com.myorg.fanout.engine.hydrate.HydrationSupport;

import java.util.concurrent.CompletableFuture;

public class DatasetHydrator extends AbstractVariantHydrator {

    public DatasetHydrator(HydrationSupport support) {
        super(support);
    }

    @Override
    public String actionType() {
        return "dataset";
    }

    @Override
    public CompletableFuture<Void> hydrate(HydrationContext ctx, ObjectNode dataset, HydrationScope scope) {
        return allowed(ctx, dataset).thenCompose(ok -> {
            if (!ok) {
                ctx.reject(dataset, scope);
                return FanoutFutures.done();
            }
            return FanoutFutures.all(
                    author(dataset),
                    fill(dataset, latest(CollectionNames.NOTES, "parentId")),
                    latestComments(dataset));
        });
    }
}
