package com.myorg.fanout.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.contracts.core.conventions.Channels;
import com.myorg.fanout.contracts.core.conventions.CollectionNames;
import com.myorg.fanout.contracts.core.conventions.Topics;
import com.myorg.fanout.contracts.core.exception.DuplicateSubscriptionException;
import com.myorg.fanout.contracts.core.exception.FanoutException;
import com.myorg.fanout.contracts.core.exception.FanoutNotFoundException;
import com.myorg.fanout.contracts.core.exception.FanoutValidationException;
import com.myorg.fanout.contracts.model.Event;
import com.myorg.fanout.contracts.model.IdentitySnapshot;
import com.myorg.fanout.contracts.model.Notification;
import com.myorg.fanout.contracts.model.Subscription;
import com.myorg.fanout.contracts.model.SubscriptionMeta;
import com.myorg.fanout.contracts.model.SubscriptionStyle;
import com.myorg.fanout.contracts.publish.NotifyRole;
import com.myorg.fanout.contracts.publish.PublishOptions;
import com.myorg.fanout.contracts.publish.PublishRequest;
import com.myorg.fanout.engine.concurrent.FanoutFutures;
import com.myorg.fanout.engine.join.Joiner;
import com.myorg.fanout.engine.join.Profile;
import com.myorg.fanout.engine.join.Profiles;
import com.myorg.fanout.engine.store.NotificationStore;
import com.myorg.fanout.engine.store.SubscriptionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Subscription lifecycle: {@code none -> request -> follow}, or straight to watch/follow. Every
 * transition is announced through the {@link FanoutPublisher}.
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultSubscriptionManager implements SubscriptionManager {

    static final String FALLBACK_EMAIL = "foo@bar.baz";

    private final SubscriptionStore subscriptions;
    private final NotificationStore notifications;
    private final Joiner joiner;
    private final FanoutPublisher publisher;
    private final ObjectMapper mapper;
    private final Executor executor;
    private final FanoutEngineProperties props;

    private record Created(Subscription subscription, boolean fresh) {}

    @Override
    public CompletableFuture<Subscription> subscribe(String subscriberId, String subscribeeId, SubscriptionMeta meta) {
        try {
            requireId(subscriberId, "subscriberId");
            requireId(subscribeeId, "subscribeeId");
            if (meta == null || meta.getStyle() == null || !StringUtils.hasText(meta.getType())) {
                throw new FanoutValidationException("meta.type and meta.style are required");
            }
            if (meta.getStyle() == SubscriptionStyle.ACCEPT) {
                throw new FanoutValidationException("accept is reached through accept(), not subscribe()");
            }
        } catch (FanoutException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<ObjectNode> subscriber = load(Profiles.MEMBER, subscriberId);
        CompletableFuture<ObjectNode> subscribee = load(Profiles.forType(meta.getType()), subscribeeId);

        return FanoutFutures.all(subscriber, subscribee)
                .thenCompose(v -> FanoutFutures.supply(executor, "create subscription",
                        () -> create(subscriberId, subscribeeId, meta)))
                .thenCompose(created -> {
                    if (!created.fresh()) {
                        return CompletableFuture.completedFuture(created.subscription());
                    }
                    log.info("Subscription created id={} style={} subscriberId={} subscribeeId={}",
                            created.subscription().getId(), meta.getStyle().wireName(), subscriberId, subscribeeId);
                    return announce(created.subscription(), subscriber.join(), subscribee.join())
                            .thenApply(r -> created.subscription());
                });
    }

    @Override
    public CompletableFuture<Subscription> accept(Subscription subscription) {
        try {
            if (subscription == null || !StringUtils.hasText(subscription.getId())) {
                throw new FanoutValidationException("subscription id is required");
            }
            if (subscription.style() != SubscriptionStyle.REQUEST) {
                throw new FanoutValidationException("only a pending request can be accepted, style=" + subscription.style());
            }
        } catch (FanoutException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<ObjectNode> subscriber = load(Profiles.MEMBER_CONTACT, subscription.getSubscriberId());
        CompletableFuture<ObjectNode> subscribee = load(
                Profiles.forType(subscription.getMeta().getType()), subscription.getSubscribeeId());
        CompletableFuture<Integer> updated = FanoutFutures.supply(executor, "accept subscription",
                () -> subscriptions.updateStyle(subscription.getId(), SubscriptionStyle.REQUEST, SubscriptionStyle.FOLLOW));

        return FanoutFutures.all(subscriber, subscribee, updated).thenCompose(v -> {
            if (updated.join() == 0) {
                throw new FanoutNotFoundException(CollectionNames.SUBSCRIPTIONS, subscription.getId());
            }
            Subscription accepted = subscription.toBuilder()
                    .meta(subscription.getMeta().toBuilder().style(SubscriptionStyle.FOLLOW).build())
                    .build();
            log.info("Subscription accepted id={} subscriberId={} subscribeeId={}",
                    accepted.getId(), accepted.getSubscriberId(), accepted.getSubscribeeId());

            ObjectNode follower = subscriber.join();
            ObjectNode followed = subscribee.join();
            ObjectNode raw = rawData(accepted, follower, followed);

            Event acceptEvent = Event.builder()
                    .actorId(accepted.getSubscribeeId())
                    .targetId(accepted.getSubscriberId())
                    .actionId(accepted.getId())
                    .actionType(SubscriptionStyle.ACCEPT.wireName())
                    .data(snapshot(followed, SubscriptionStyle.ACCEPT, gravatarOf(followed), follower))
                    .build();
            Event followEvent = Event.builder()
                    .actorId(accepted.getSubscriberId())
                    .targetId(accepted.getSubscribeeId())
                    .actionId(accepted.getId())
                    .actionType(SubscriptionStyle.FOLLOW.wireName())
                    .data(snapshot(follower, SubscriptionStyle.FOLLOW, emailHash(follower), followed))
                    .build();

            return FanoutFutures.all(
                    publishEvent(SubscriptionStyle.ACCEPT, acceptEvent, raw, accepted, NotifyRole.SUBSCRIBER),
                    publishEvent(SubscriptionStyle.FOLLOW, followEvent, raw, accepted, NotifyRole.SUBSCRIBEE)
            ).thenApply(x -> accepted);
        });
    }

    @Override
    public CompletableFuture<Optional<Subscription>> unsubscribe(String subscriberId, String subscribeeId) {
        try {
            requireId(subscriberId, "subscriberId");
            requireId(subscribeeId, "subscribeeId");
        } catch (FanoutException e) {
            return CompletableFuture.failedFuture(e);
        }

        return FanoutFutures.supply(executor, "find subscription",
                        () -> subscriptions.findByPair(subscriberId, subscribeeId))
                .thenCompose(found -> {
                    if (found.isEmpty()) {
                        log.debug("Nothing to unsubscribe subscriberId={} subscribeeId={}", subscriberId, subscribeeId);
                        return CompletableFuture.completedFuture(Optional.<Subscription>empty());
                    }
                    Subscription sub = found.get();
                    CompletableFuture<Integer> removed = FanoutFutures.supply(executor, "remove subscription",
                            () -> subscriptions.remove(sub.getId()));
                    CompletableFuture<List<Notification>> notes = FanoutFutures.supply(executor, "list notifications",
                            () -> notifications.listBySubscription(sub.getId()));

                    return FanoutFutures.all(removed, notes).thenCompose(v -> {
                        if (removed.join() == 0) {
                            log.info("Subscription already removed id={}", sub.getId());
                            return CompletableFuture.completedFuture(Optional.<Subscription>empty());
                        }
                        return announceRemoval(sub, notes.join()).thenApply(x -> Optional.of(sub));
                    });
                });
    }

    private Created create(String subscriberId, String subscribeeId, SubscriptionMeta meta) {
        Subscription candidate = Subscription.builder()
                .subscriberId(subscriberId)
                .subscribeeId(subscribeeId)
                .meta(meta.toBuilder().build())
                .mute(false)
                .build();
        try {
            return new Created(subscriptions.create(candidate), true);
        } catch (DuplicateSubscriptionException e) {
            log.info("Subscription already exists subscriberId={} subscribeeId={}", subscriberId, subscribeeId);
            Subscription existing = subscriptions.findByPair(subscriberId, subscribeeId).orElseThrow(() -> e);
            return new Created(existing, false);
        }
    }

    private CompletableFuture<?> announce(Subscription sub, ObjectNode subscriber, ObjectNode subscribee) {
        SubscriptionStyle style = sub.style();
        ObjectNode raw = rawData(sub, subscriber, subscribee);
        if (style == SubscriptionStyle.WATCH) {
            return publisher.publish(style.wireName(), Topics.created(style.wireName()), PublishRequest.of(raw));
        }
        Event event = Event.builder()
                .actorId(sub.getSubscriberId())
                .targetId(sub.getSubscribeeId())
                .actionId(sub.getId())
                .actionType(style.wireName())
                .data(snapshot(subscriber, style, gravatarOf(subscriber), subscribee))
                .build();
        return publishEvent(style, event, raw, sub, NotifyRole.SUBSCRIBEE);
    }

    private CompletableFuture<?> publishEvent(SubscriptionStyle style, Event event, ObjectNode raw,
                                              Subscription sub, NotifyRole notify) {
        PublishRequest request = PublishRequest.builder()
                .data(raw)
                .event(event)
                .options(PublishOptions.withSubscription(sub.getId()))
                .notify(EnumSet.of(notify))
                .build();
        return publisher.publish(style.wireName(), Topics.created(style.wireName()), request);
    }

    private CompletableFuture<?> announceRemoval(Subscription sub, List<Notification> notes) {
        String topic = Topics.removed(sub.style().wireName());
        ObjectNode idOnly = mapper.createObjectNode().put("id", sub.getId());

        List<CompletableFuture<?>> sends = new ArrayList<>();
        sends.add(publishTo(sub.getSubscriberId(), topic, idOnly));
        if (sub.style() == SubscriptionStyle.FOLLOW) {
            sends.add(publishTo(sub.getSubscribeeId(), topic, idOnly));
        }
        for (Notification note : notes) {
            sends.add(publishTo(note.getSubscriberId(), Topics.NOTIFICATION_REMOVED,
                    mapper.createObjectNode().put("id", note.getId())));
        }
        return FanoutFutures.all(sends).thenCompose(v -> FanoutFutures.supply(executor, "remove notifications",
                () -> notifications.removeBySubscription(sub.getId())))
                .thenAccept(n -> log.info("Subscription removed id={} notificationsRemoved={}", sub.getId(), n));
    }

    private CompletableFuture<?> publishTo(String memberId, String topic, ObjectNode data) {
        return publisher.publish(Channels.privateChannel(props.getPrivateChannelPrefix(), memberId), topic,
                PublishRequest.of(data.deepCopy()));
    }

    private CompletableFuture<ObjectNode> load(Profile profile, String id) {
        return FanoutFutures.supply(executor, "load " + profile.collection(),
                () -> joiner.lookup(profile, id)
                        .orElseThrow(() -> new FanoutNotFoundException(profile.collection(), id)));
    }

    private ObjectNode rawData(Subscription sub, ObjectNode subscriber, ObjectNode subscribee) {
        ObjectNode raw = mapper.valueToTree(sub);
        raw.set("subscriber", publicView(subscriber));
        raw.set("subscribee", publicView(subscribee));
        return raw;
    }

    private ObjectNode snapshot(ObjectNode actor, SubscriptionStyle style, String gravatar, ObjectNode target) {
        ObjectNode data = mapper.createObjectNode();
        data.set("action", mapper.valueToTree(IdentitySnapshot.actor(
                text(actor, "id"), displayName(actor), gravatar, style.wireName(), text(actor, "username"))));
        data.set("target", mapper.valueToTree(IdentitySnapshot.target(
                text(target, "id"), displayName(target), text(target, "username"))));
        return data;
    }

    // contact fields never leave the engine
    private static ObjectNode publicView(ObjectNode profile) {
        ObjectNode copy = profile.deepCopy();
        copy.remove("primaryEmail");
        copy.remove("config");
        return copy;
    }

    static String emailHash(ObjectNode member) {
        String email = text(member, "primaryEmail");
        String source = StringUtils.hasText(email) ? email : FALLBACK_EMAIL;
        return DigestUtils.md5DigestAsHex(source.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
    }

    private static String gravatarOf(ObjectNode profile) {
        return text(profile, "gravatar");
    }

    private static String displayName(ObjectNode profile) {
        for (String field : new String[]{"displayName", "name", "title"}) {
            String v = text(profile, field);
            if (v != null) return v;
        }
        return null;
    }

    private static String text(ObjectNode node, String field) {
        return node != null && node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static void requireId(String id, String name) {
        if (!StringUtils.hasText(id)) throw new FanoutValidationException(name + " is required");
    }
}
