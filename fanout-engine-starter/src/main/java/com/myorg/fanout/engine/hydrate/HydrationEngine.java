package com.myorg.fanout.engine.hydrate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.contracts.core.conventions.CollectionNames;
import com.myorg.fanout.contracts.model.Event;
import com.myorg.fanout.contracts.model.SubscriptionStyle;
import com.myorg.fanout.engine.concurrent.FanoutFutures;
import com.myorg.fanout.engine.join.Joiner;
import com.myorg.fanout.engine.join.Profile;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Builds the read-optimized view of an event: loads its action from the collection named by
 * {@code actionType}, then hands it to the variant hydrator for that type. Variants recurse into
 * nested content and may reject single items or the whole event when access is denied.
 *
 * <p>Social events (watch, follow, request, accept) carry their snapshot in {@code data} and are
 * returned as they are.
 */
@Slf4j
public class HydrationEngine {

    public static final Set<String> SOCIAL_TYPES = Arrays.stream(SubscriptionStyle.values())
            .map(SubscriptionStyle::wireName)
            .collect(Collectors.toUnmodifiableSet());

    private final HydratorRegistry registry;
    private final Joiner joiner;
    private final ObjectMapper mapper;
    private final Executor executor;
    private final boolean authorize;

    public HydrationEngine(HydratorRegistry registry, Joiner joiner, ObjectMapper mapper,
                           Executor executor, boolean authorize) {
        this.registry = registry;
        this.joiner = joiner;
        this.mapper = mapper;
        this.executor = executor;
        this.authorize = authorize;
    }

    /**
     * @param requesterId member the view is built for, null for an anonymous requester
     */
    public CompletableFuture<HydratedEvent> hydrate(Event event, String requesterId) {
        ObjectNode view = mapper.valueToTree(event);
        String type = event.getActionType();
        if (type == null || SOCIAL_TYPES.contains(type)) {
            return CompletableFuture.completedFuture(new HydratedEvent(view, false));
        }

        HydrationContext ctx = new HydrationContext(view, requesterId, authorize, registry);
        return FanoutFutures.run(executor, "load action",
                        () -> joiner.inflate(view, Map.of("action", Profile.all(CollectionNames.forType(type)))))
                .thenCompose(v -> {
                    JsonNode action = view.get("action");
                    if (action == null || !action.isObject()) {
                        log.warn("Action not found, event rejected eventId={} actionType={} actionId={}",
                                event.getId(), type, event.getActionId());
                        ctx.rejectEvent();
                        return FanoutFutures.done();
                    }
                    return ctx.descend(type, (ObjectNode) action, HydrationScope.EVENT);
                })
                .thenApply(v -> new HydratedEvent(view, ctx.isEventRejected()));
    }
}
