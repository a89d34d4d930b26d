package com.myorg.fanout.engine.hydrate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.engine.concurrent.FanoutFutures;
import com.myorg.fanout.engine.join.Profile;
import com.myorg.fanout.engine.join.Profiles;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Actions that hang off a polymorphic parent (hangtens, comments, notes). The parent named by
 * {@code parentType} is loaded from the event's {@code targetId} as {@code target} and hydrated
 * with its own variant.
 */
@Slf4j
public class ParentedActionHydrator extends AbstractVariantHydrator {

    private final String actionType;
    private final Set<String> parentTypes;

    public ParentedActionHydrator(HydrationSupport support, String actionType, Set<String> parentTypes) {
        super(support);
        this.actionType = actionType;
        this.parentTypes = Set.copyOf(parentTypes);
    }

    @Override
    public String actionType() {
        return actionType;
    }

    @Override
    public CompletableFuture<Void> hydrate(HydrationContext ctx, ObjectNode action, HydrationScope scope) {
        String parentType;
        synchronized (action) {
            parentType = action.path("parentType").asText(null);
        }
        if (parentType == null || parentType.isBlank()) {
            log.debug("{} without parentType, only the author is joined", actionType);
            return author(action);
        }
        ObjectNode view = ctx.getView();
        CompletableFuture<Void> target = inflate(view, Map.of("target", Profile.all(Profiles.forType(parentType).collection())));
        return FanoutFutures.all(author(action), target)
                .thenCompose(v -> {
                    JsonNode loaded = view.get("target");
                    if (loaded == null || !loaded.isObject()) {
                        log.warn("{} parent not found parentType={} targetId={}",
                                actionType, parentType, view.path("targetId").asText(null));
                        return FanoutFutures.done();
                    }
                    if (!parentTypes.contains(parentType)) {
                        log.info("{} parentType={} is not hydrated further", actionType, parentType);
                        return FanoutFutures.done();
                    }
                    return ctx.descend(parentType, (ObjectNode) loaded, HydrationScope.EVENT);
                });
    }
}
