package com.myorg.fanout.engine.hydrate.climbing;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.engine.concurrent.FanoutFutures;
import com.myorg.fanout.engine.hydrate.AbstractVariantHydrator;
import com.myorg.fanout.engine.hydrate.HydrationContext;
import com.myorg.fanout.engine.hydrate.HydrationScope;
import com.myorg.fanout.engine.hydrate.HydrationSupport;

import java.util.concurrent.CompletableFuture;

public class PostHydrator extends AbstractVariantHydrator {

    public PostHydrator(HydrationSupport support) {
        super(support);
    }

    @Override
    public String actionType() {
        return "post";
    }

    @Override
    public CompletableFuture<Void> hydrate(HydrationContext ctx, ObjectNode post, HydrationScope scope) {
        return FanoutFutures.all(author(post), medias(post), latestComments(post), hangtens(post));
    }
}
