package com.myorg.fanout.engine.hydrate.climbing;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.engine.concurrent.FanoutFutures;
import com.myorg.fanout.engine.hydrate.AbstractVariantHydrator;
import com.myorg.fanout.engine.hydrate.HydrationContext;
import com.myorg.fanout.engine.hydrate.HydrationScope;
import com.myorg.fanout.engine.hydrate.HydrationSupport;

import java.util.concurrent.CompletableFuture;

public class CragHydrator extends AbstractVariantHydrator {

    public CragHydrator(HydrationSupport support) {
        super(support);
    }

    @Override
    public String actionType() {
        return "crag";
    }

    @Override
    public CompletableFuture<Void> hydrate(HydrationContext ctx, ObjectNode crag, HydrationScope scope) {
        return allowed(ctx, crag).thenCompose(ok -> {
            if (!ok) {
                ctx.reject(crag, scope);
                return FanoutFutures.done();
            }
            return FanoutFutures.all(author(crag), hangtens(crag));
        });
    }
}
