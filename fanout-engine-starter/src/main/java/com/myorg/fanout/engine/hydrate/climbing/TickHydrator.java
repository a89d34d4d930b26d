package com.myorg.fanout.engine.hydrate.climbing;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.engine.concurrent.FanoutFutures;
import com.myorg.fanout.engine.hydrate.AbstractVariantHydrator;
import com.myorg.fanout.engine.hydrate.HydrationContext;
import com.myorg.fanout.engine.hydrate.HydrationScope;
import com.myorg.fanout.engine.hydrate.HydrationSupport;
import com.myorg.fanout.engine.join.Profiles;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Ticks are access-checked before anything is joined. A denied tick rejects the event when it is
 * the event's own action or target, otherwise only itself.
 */
@Slf4j
public class TickHydrator extends AbstractVariantHydrator {

    public TickHydrator(HydrationSupport support) {
        super(support);
    }

    @Override
    public String actionType() {
        return "tick";
    }

    @Override
    public CompletableFuture<Void> hydrate(HydrationContext ctx, ObjectNode tick, HydrationScope scope) {
        return allowed(ctx, tick).thenCompose(ok -> {
            if (!ok) {
                log.debug("Tick denied tickId={} scope={}", tick.path("id").asText(null), scope);
                ctx.reject(tick, scope);
                return FanoutFutures.done();
            }
            return FanoutFutures.all(
                    inflate(tick, Map.of(
                            "author", Profiles.MEMBER,
                            "ascent", Profiles.ASCENT,
                            "crag", Profiles.CRAG)),
                    medias(tick),
                    latestComments(tick),
                    hangtens(tick));
        });
    }
}
