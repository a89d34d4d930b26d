package com.myorg.fanout.engine.hydrate.climbing;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.engine.concurrent.FanoutFutures;
import com.myorg.fanout.engine.hydrate.AbstractVariantHydrator;
import com.myorg.fanout.engine.hydrate.HydrationContext;
import com.myorg.fanout.engine.hydrate.HydrationScope;
import com.myorg.fanout.engine.hydrate.HydrationSupport;
import com.myorg.fanout.engine.join.Profiles;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class AscentHydrator extends AbstractVariantHydrator {

    public AscentHydrator(HydrationSupport support) {
        super(support);
    }

    @Override
    public String actionType() {
        return "ascent";
    }

    @Override
    public CompletableFuture<Void> hydrate(HydrationContext ctx, ObjectNode ascent, HydrationScope scope) {
        return allowed(ctx, ascent).thenCompose(ok -> {
            if (!ok) {
                ctx.reject(ascent, scope);
                return FanoutFutures.done();
            }
            return FanoutFutures.all(
                    inflate(ascent, Map.of("author", Profiles.MEMBER, "crag", Profiles.CRAG)),
                    hangtens(ascent));
        });
    }
}
