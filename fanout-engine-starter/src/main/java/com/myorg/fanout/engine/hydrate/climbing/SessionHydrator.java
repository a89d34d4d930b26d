package com.myorg.fanout.engine.hydrate.climbing;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.contracts.core.conventions.CollectionNames;
import com.myorg.fanout.engine.concurrent.FanoutFutures;
import com.myorg.fanout.engine.hydrate.AbstractVariantHydrator;
import com.myorg.fanout.engine.hydrate.HydrationContext;
import com.myorg.fanout.engine.hydrate.HydrationScope;
import com.myorg.fanout.engine.hydrate.HydrationSupport;
import com.myorg.fanout.engine.join.FillSpec;
import com.myorg.fanout.engine.join.Profiles;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A session groups actions, each holding ticks. Every tick goes through tick hydration; denied
 * ticks are dropped, and a session left without any tick is rejected.
 */
@Slf4j
public class SessionHydrator extends AbstractVariantHydrator {

    public SessionHydrator(HydrationSupport support) {
        super(support);
    }

    @Override
    public String actionType() {
        return "session";
    }

    @Override
    public CompletableFuture<Void> hydrate(HydrationContext ctx, ObjectNode session, HydrationScope scope) {
        return FanoutFutures.all(
                        inflate(session, Map.of("author", Profiles.MEMBER, "crag", Profiles.CRAG)),
                        fill(session, FillSpec.of(CollectionNames.ACTIONS, "sessionId").sortedBy("index", 1)))
                .thenCompose(v -> fill(objects(session.get("actions")),
                        FillSpec.of(CollectionNames.TICKS, "actionId").sortedBy("index", 1)))
                .thenCompose(v -> {
                    List<CompletableFuture<Void>> ticks = new ArrayList<>();
                    for (ObjectNode action : objects(session.get("actions"))) {
                        for (ObjectNode tick : objects(action.get("ticks"))) {
                            ticks.add(ctx.descend("tick", tick, HydrationScope.ITEM));
                        }
                    }
                    return FanoutFutures.all(ticks);
                })
                .thenRun(() -> {
                    int surviving = 0;
                    for (ObjectNode action : objects(session.get("actions"))) {
                        ArrayNode kept = action.arrayNode();
                        for (ObjectNode tick : objects(action.get("ticks"))) {
                            if (!ctx.isRejected(tick)) kept.add(tick);
                        }
                        action.set("ticks", kept);
                        surviving += kept.size();
                    }
                    if (surviving == 0) {
                        log.debug("No visible tick left in session sessionId={}", session.path("id").asText(null));
                        ctx.reject(session, scope);
                    }
                });
    }
}
