package com.myorg.fanout.engine.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.contracts.core.conventions.Channels;
import com.myorg.fanout.contracts.core.conventions.Topics;
import com.myorg.fanout.contracts.model.Event;
import com.myorg.fanout.contracts.model.Member;
import com.myorg.fanout.contracts.model.Notification;
import com.myorg.fanout.contracts.publish.NotifyRole;
import com.myorg.fanout.engine.concurrent.FanoutFutures;
import com.myorg.fanout.engine.email.EmailNotifier;
import com.myorg.fanout.engine.resolve.Recipient;
import com.myorg.fanout.engine.store.NotificationStore;
import com.myorg.fanout.engine.transport.LiveTransport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Persists one notification per recipient and role, pushes it live, and queues the optional email.
 *
 * <p>The subscription's own subscriber is never notified about an event they performed. Email is
 * fire-and-forget: failures are logged and do not affect the returned future.
 */
@Slf4j
public class NotificationDispatcher {

    private final NotificationStore notifications;
    private final LiveTransport transport;          // nullable
    private final EmailNotifier emailNotifier;      // nullable
    private final boolean emailDelivery;
    private final String privatePrefix;
    private final ObjectMapper mapper;
    private final Executor executor;

    public NotificationDispatcher(NotificationStore notifications,
                                  LiveTransport transport,
                                  EmailNotifier emailNotifier,
                                  boolean emailDelivery,
                                  String privatePrefix,
                                  ObjectMapper mapper,
                                  Executor executor) {
        this.notifications = notifications;
        this.transport = transport;
        this.emailNotifier = emailNotifier;
        this.emailDelivery = emailDelivery;
        this.privatePrefix = privatePrefix;
        this.mapper = mapper;
        this.executor = executor;
    }

    /**
     * @param channel publish channel, selects the member's per-channel email preference
     * @param view    event as delivered to clients, embedded in each live notification
     * @param body    free-form email content, may be null
     * @return number of notifications created
     */
    public CompletableFuture<Integer> dispatch(String channel, Event event, JsonNode view,
                                               List<Recipient> recipients, Set<NotifyRole> roles, JsonNode body) {
        if (roles == null || roles.isEmpty() || recipients.isEmpty()) {
            return CompletableFuture.completedFuture(0);
        }
        List<CompletableFuture<Boolean>> units = new ArrayList<>();
        for (Recipient r : recipients) {
            for (NotifyRole role : roles) {
                units.add(FanoutFutures.supply(executor, "notify " + role.name().toLowerCase(),
                        () -> deliver(channel, event, view, r, role, body)));
            }
        }
        return FanoutFutures.all(units).thenApply(v -> {
            int created = 0;
            for (CompletableFuture<Boolean> u : units) {
                if (Boolean.TRUE.equals(u.join())) created++;
            }
            return created;
        });
    }

    private boolean deliver(String channel, Event event, JsonNode view, Recipient r, NotifyRole role, JsonNode body) {
        Member recipient = r.member(role);
        if (recipient == null || recipient.getId() == null) {
            log.debug("No {} profile for subscriptionId={}, skipped", role, r.getSubscription().getId());
            return false;
        }
        String subscriberId = r.getSubscription().getSubscriberId();
        if (recipient.getId().equals(subscriberId) && subscriberId.equals(event.getActorId())) {
            return false;
        }

        Notification note = notifications.create(Notification.builder()
                .subscriberId(recipient.getId())
                .subscriptionId(r.getSubscription().getId())
                .eventId(event.getId())
                .read(false)
                .build());

        if (transport != null) {
            ObjectNode payload = mapper.valueToTree(note);
            payload.set("event", view);
            transport.send(Channels.privateChannel(privatePrefix, recipient.getId()), Topics.NOTIFICATION_NEW, payload);
        }

        if (emailNotifier != null && emailDelivery
                && recipient.emailEnabledFor(channel) && recipient.hasUsableEmail()) {
            sendEmail(recipient, note, body);
        }
        return true;
    }

    private void sendEmail(Member recipient, Notification note, JsonNode body) {
        CompletableFuture<Void> sent;
        try {
            sent = emailNotifier.notify(recipient, note, body);
        } catch (RuntimeException e) {
            log.error("Email delivery failed notificationId={} recipientId={}", note.getId(), recipient.getId(), e);
            return;
        }
        if (sent == null) return;
        sent.whenComplete((v, e) -> {
            if (e != null) {
                log.error("Email delivery failed notificationId={} recipientId={}",
                        note.getId(), recipient.getId(), FanoutFutures.unwrap(e));
            } else {
                log.debug("Email sent notificationId={} recipientId={}", note.getId(), recipient.getId());
            }
        });
    }
}
