package com.myorg.fanout.engine.resolve;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.contracts.core.exception.UnknownResolutionMethodException;
import com.myorg.fanout.contracts.model.Event;
import com.myorg.fanout.contracts.model.Member;
import com.myorg.fanout.contracts.model.Subscription;
import com.myorg.fanout.contracts.publish.PublishOptions;
import com.myorg.fanout.contracts.publish.ResolutionMethod;
import com.myorg.fanout.engine.access.AccessPredicate;
import com.myorg.fanout.engine.concurrent.FanoutFutures;
import com.myorg.fanout.engine.join.Joiner;
import com.myorg.fanout.engine.join.Profile;
import com.myorg.fanout.engine.join.Profiles;
import com.myorg.fanout.engine.store.DocumentQuery;
import com.myorg.fanout.engine.store.SubscriptionStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Turns an event into the subscriptions that should hear about it, with both parties' profiles
 * joined. Strategies are looked up by {@link ResolutionMethod}.
 */
@Slf4j
public class RecipientResolver {

    private final Map<ResolutionMethod, ResolutionStrategy> strategies = new EnumMap<>(ResolutionMethod.class);
    private final SubscriptionStore subscriptions;
    private final Joiner joiner;
    private final AccessPredicate access;
    private final ObjectMapper mapper;
    private final Executor executor;

    public RecipientResolver(List<ResolutionStrategy> strategies,
                             SubscriptionStore subscriptions,
                             Joiner joiner,
                             AccessPredicate access,
                             ObjectMapper mapper,
                             Executor executor) {
        for (ResolutionStrategy s : strategies) {
            // first one wins, application beans are registered ahead of the built-ins
            ResolutionStrategy kept = this.strategies.putIfAbsent(s.method(), s);
            if (kept != null) {
                log.info("Resolution strategy for {} already set, keeping {} over {}",
                        s.method(), kept.getClass().getSimpleName(), s.getClass().getSimpleName());
            }
        }
        this.subscriptions = subscriptions;
        this.joiner = joiner;
        this.access = access;
        this.mapper = mapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.executor = executor;
    }

    public CompletableFuture<List<Recipient>> resolve(Event event, ResolutionMethod method,
                                                      PublishOptions options, boolean joinSubscribee) {
        ResolutionStrategy strategy = strategies.get(method);
        if (strategy == null) {
            return CompletableFuture.failedFuture(new UnknownResolutionMethodException(method));
        }
        Optional<DocumentQuery> query = strategy.query(event, options);
        if (query.isEmpty()) {
            log.debug("Nothing to resolve method={} eventId={}", method, event.getId());
            return CompletableFuture.completedFuture(List.of());
        }
        return FanoutFutures.supply(executor, "list subscriptions", () -> subscriptions.list(query.get()))
                .thenCompose(found -> joinProfiles(found, joinSubscribee))
                .thenCompose(recipients -> strategy.recheckAccess()
                        ? recheckAccess(recipients)
                        : CompletableFuture.completedFuture(recipients));
    }

    private CompletableFuture<List<Recipient>> joinProfiles(List<Subscription> found, boolean joinSubscribee) {
        List<Recipient> recipients = new ArrayList<>(found.size());
        List<CompletableFuture<Void>> joins = new ArrayList<>(found.size());
        for (Subscription sub : found) {
            Recipient r = new Recipient(sub);
            recipients.add(r);
            joins.add(FanoutFutures.run(executor, "join subscription profiles", () -> {
                r.setSubscriber(member(sub.getSubscriberId()));
                if (joinSubscribee) {
                    r.setSubscribee(member(sub.getSubscribeeId()));
                }
            }));
        }
        return FanoutFutures.all(joins).thenApply(v -> {
            List<Recipient> out = new ArrayList<>(recipients.size());
            for (Recipient r : recipients) {
                if (r.getSubscriber() == null) {
                    log.warn("Dropping subscription with unknown subscriber subscriptionId={} subscriberId={}",
                            r.getSubscription().getId(), r.getSubscription().getSubscriberId());
                    continue;
                }
                out.add(r);
            }
            return out;
        });
    }

    private CompletableFuture<List<Recipient>> recheckAccess(List<Recipient> recipients) {
        List<CompletableFuture<Void>> checks = new ArrayList<>(recipients.size());
        for (Recipient r : recipients) {
            Subscription sub = r.getSubscription();
            checks.add(FanoutFutures.run(executor, "access re-check", () -> {
                String type = sub.getMeta() == null ? null : sub.getMeta().getType();
                Optional<ObjectNode> resource = type == null
                        ? Optional.empty()
                        : joiner.lookup(Profile.all(Profiles.forType(type).collection()), sub.getSubscribeeId());
                if (resource.isEmpty() || !access.canAccess(sub.getSubscriberId(), resource.get())) {
                    r.setRejected(true);
                }
            }));
        }
        return FanoutFutures.all(checks).thenApply(v -> {
            List<Recipient> allowed = new ArrayList<>(recipients.size());
            for (Recipient r : recipients) {
                if (r.isRejected()) {
                    log.debug("Access denied subscriptionId={} subscriberId={}",
                            r.getSubscription().getId(), r.getSubscription().getSubscriberId());
                } else {
                    allowed.add(r);
                }
            }
            return allowed;
        });
    }

    private Member member(String id) {
        return joiner.lookup(Profiles.MEMBER_CONTACT, id)
                .map(doc -> mapper.convertValue(doc, Member.class))
                .orElse(null);
    }
}
