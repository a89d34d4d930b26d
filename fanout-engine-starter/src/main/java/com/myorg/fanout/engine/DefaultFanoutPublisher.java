package com.myorg.fanout.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.contracts.core.conventions.Channels;
import com.myorg.fanout.contracts.core.conventions.CollectionNames;
import com.myorg.fanout.contracts.core.conventions.Topics;
import com.myorg.fanout.contracts.core.exception.FanoutException;
import com.myorg.fanout.contracts.core.exception.FanoutNotFoundException;
import com.myorg.fanout.contracts.core.exception.FanoutValidationException;
import com.myorg.fanout.contracts.core.exception.UpstreamException;
import com.myorg.fanout.contracts.model.Event;
import com.myorg.fanout.contracts.publish.NotifyRole;
import com.myorg.fanout.contracts.publish.PublishOptions;
import com.myorg.fanout.contracts.publish.PublishReceipt;
import com.myorg.fanout.contracts.publish.PublishRequest;
import com.myorg.fanout.contracts.publish.ResolutionMethod;
import com.myorg.fanout.engine.concurrent.FanoutFutures;
import com.myorg.fanout.engine.dispatch.NotificationDispatcher;
import com.myorg.fanout.engine.hydrate.HydratedEvent;
import com.myorg.fanout.engine.hydrate.HydrationEngine;
import com.myorg.fanout.engine.resolve.Recipient;
import com.myorg.fanout.engine.resolve.RecipientResolver;
import com.myorg.fanout.engine.store.EventStore;
import com.myorg.fanout.engine.transport.LiveTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Publish pipeline:
 * <ol>
 *   <li>validate, then push the raw data on {@code channel} (or only to the author's private
 *       channel when the data is marked {@code public: false});</li>
 *   <li>create the event, or amend it when it carries an id;</li>
 *   <li>resolve recipients, hydrate the event for an anonymous viewer;</li>
 *   <li>drop the event if hydration rejected it, otherwise push {@code event.new} and dispatch
 *       notifications.</li>
 * </ol>
 * Persisted records are never rolled back when a later step fails.
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultFanoutPublisher implements FanoutPublisher {

    private final EventStore events;
    private final RecipientResolver resolver;
    private final HydrationEngine hydration;
    private final NotificationDispatcher dispatcher;
    private final LiveTransport transport;   // nullable
    private final Executor executor;
    private final FanoutEngineProperties props;

    @Override
    public CompletableFuture<PublishReceipt> publish(String channel, String topic, PublishRequest request) {
        PublishRequest req;
        String privateAuthor;
        Long date;
        try {
            validate(channel, topic, request);
            req = request.copy();
            privateAuthor = isPublic(req.getData()) ? null : authorOf(req.getData());
            // only new events take their date from the data
            date = req.hasEvent() && !StringUtils.hasText(req.getEvent().getId()) ? eventDate(req) : null;
            sendRaw(channel, topic, req.getData(), privateAuthor);
        } catch (FanoutException e) {
            return CompletableFuture.failedFuture(e);
        }

        if (!req.hasEvent()) {
            return CompletableFuture.completedFuture(PublishReceipt.rawOnly());
        }
        return persist(req, date).thenCompose(event -> fanOut(channel, event, req));
    }

    private CompletableFuture<Event> persist(PublishRequest req, Long date) {
        Event event = req.getEvent();
        if (StringUtils.hasText(event.getId())) {
            String id = event.getId();
            return FanoutFutures.supply(executor, "update event", () -> {
                if (events.update(id, req.getEventPatch()) == 0) {
                    throw new FanoutNotFoundException(CollectionNames.EVENTS, id);
                }
                return events.findById(id).orElseThrow(() -> new FanoutNotFoundException(CollectionNames.EVENTS, id));
            });
        }
        Event toCreate = event.getDate() == null ? event.toBuilder().date(date).build() : event;
        return FanoutFutures.supply(executor, "create event", () -> events.create(toCreate));
    }

    private CompletableFuture<PublishReceipt> fanOut(String channel, Event event, PublishRequest req) {
        PublishOptions options = req.getOptions() == null ? new PublishOptions() : req.getOptions();
        ResolutionMethod method = options.getMethod() == null ? props.getDefaultMethod() : options.getMethod();
        boolean joinSubscribee = req.notifies(NotifyRole.SUBSCRIBEE);

        return resolver.resolve(event, method, options, joinSubscribee)
                .thenCompose(recipients -> hydration.hydrate(event, null)
                        .thenCompose(hydrated -> deliver(channel, event, hydrated, recipients, req)));
    }

    private CompletableFuture<PublishReceipt> deliver(String channel, Event event, HydratedEvent hydrated,
                                                      List<Recipient> recipients, PublishRequest req) {
        if (hydrated.rejected()) {
            log.warn("Event rejected by hydration, not delivered eventId={} actionType={} recipients={}",
                    event.getId(), event.getActionType(), recipients.size());
            return CompletableFuture.completedFuture(PublishReceipt.rejected(event.getId(), recipients.size()));
        }

        Set<String> channels = new LinkedHashSet<>();
        channels.add(privateChannel(event.getActorId()));
        if (event.isPublicEvent()) {
            for (Recipient r : recipients) {
                channels.add(privateChannel(r.getSubscription().getSubscriberId()));
            }
        }
        for (String target : channels) {
            send(target, Topics.EVENT_NEW, hydrated.view());
        }

        JsonNode body = req.getData() == null ? null : req.getData().get("body");
        return dispatcher.dispatch(channel, event, hydrated.view(), recipients, req.getNotify(), body)
                .thenApply(created -> {
                    log.info("Event delivered eventId={} channel={} recipients={} notifications={}",
                            event.getId(), channel, recipients.size(), created);
                    return PublishReceipt.delivered(event.getId(), recipients.size(), created);
                });
    }

    private void sendRaw(String channel, String topic, ObjectNode data, String privateAuthor) {
        if (privateAuthor == null) {
            send(channel, topic, data);
        } else {
            send(privateChannel(privateAuthor), topic, data);
        }
    }

    private void send(String channel, String topic, JsonNode payload) {
        if (transport == null) return;
        try {
            transport.send(channel, topic, payload);
        } catch (FanoutException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UpstreamException("Live transport failed channel=" + channel + " topic=" + topic, e);
        }
    }

    private String privateChannel(String memberId) {
        return Channels.privateChannel(props.getPrivateChannelPrefix(), memberId);
    }

    private static void validate(String channel, String topic, PublishRequest request) {
        if (!StringUtils.hasText(channel)) throw new FanoutValidationException("channel is required");
        if (!StringUtils.hasText(topic)) throw new FanoutValidationException("topic is required");
        if (request == null || request.getData() == null) throw new FanoutValidationException("data is required");
        if (request.hasEvent() && !StringUtils.hasText(request.getEvent().getId())) {
            Event e = request.getEvent();
            if (!StringUtils.hasText(e.getActorId())) throw new FanoutValidationException("event.actorId is required");
            if (!StringUtils.hasText(e.getActionType())) throw new FanoutValidationException("event.actionType is required");
        }
    }

    private static boolean isPublic(ObjectNode data) {
        JsonNode flag = data.get("public");
        return flag == null || !flag.isBoolean() || flag.booleanValue();
    }

    // author.id, actor.id, authorId, actorId: first one present
    private static String authorOf(ObjectNode data) {
        for (JsonNode candidate : new JsonNode[]{
                data.path("author").path("id"), data.path("actor").path("id"),
                data.path("authorId"), data.path("actorId")}) {
            if (candidate.isValueNode() && StringUtils.hasText(candidate.asText())) {
                return candidate.asText();
            }
        }
        throw new FanoutValidationException("private data needs an author id");
    }

    private static Long eventDate(PublishRequest req) {
        if (req.getEvent().getDate() != null) return req.getEvent().getDate();
        JsonNode raw = req.getData().hasNonNull("date") ? req.getData().get("date") : req.getData().get("created");
        if (raw == null || raw.isNull()) return null;
        if (raw.isNumber()) return raw.longValue();
        String text = raw.asText().trim();
        try {
            return text.chars().allMatch(Character::isDigit) ? Long.parseLong(text) : Instant.parse(text).toEpochMilli();
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new FanoutValidationException("data.date is neither epoch millis nor ISO-8601: " + text);
        }
    }
}
