package com.myorg.fanout.engine.hydrate.dataset;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.engine.concurrent.FanoutFutures;
import com.myorg.fanout.engine.hydrate.AbstractVariantHydrator;
import com.myorg.fanout.engine.hydrate.HydrationContext;
import com.myorg.fanout.engine.hydrate.HydrationScope;
import com.myorg.fanout.engine.hydrate.HydrationSupport;
import com.myorg.fanout.engine.join.Profiles;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class ViewHydrator extends AbstractVariantHydrator {

    public ViewHydrator(HydrationSupport support) {
        super(support);
    }

    @Override
    public String actionType() {
        return "view";
    }

    @Override
    public CompletableFuture<Void> hydrate(HydrationContext ctx, ObjectNode view, HydrationScope scope) {
        return allowed(ctx, view).thenCompose(ok -> {
            if (!ok) {
                ctx.reject(view, scope);
                return FanoutFutures.done();
            }
            return FanoutFutures.all(
                    inflate(view, Map.of("author", Profiles.MEMBER, "dataset", Profiles.DATASET)),
                    latestComments(view));
        });
    }
}
