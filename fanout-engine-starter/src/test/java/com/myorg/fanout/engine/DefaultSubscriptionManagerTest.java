package com.myorg.fanout.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.contracts.core.conventions.CollectionNames;
import com.myorg.fanout.contracts.core.conventions.Topics;
import com.myorg.fanout.contracts.core.exception.FanoutNotFoundException;
import com.myorg.fanout.contracts.core.exception.FanoutValidationException;
import com.myorg.fanout.contracts.core.exception.UpstreamException;
import com.myorg.fanout.contracts.model.Notification;
import com.myorg.fanout.contracts.model.Subscription;
import com.myorg.fanout.contracts.model.SubscriptionMeta;
import com.myorg.fanout.contracts.model.SubscriptionStyle;
import com.myorg.fanout.engine.store.DocumentQuery;
import com.myorg.fanout.engine.store.ListOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultSubscriptionManagerTest {

    private FanoutTestKit kit;

    @BeforeEach
    void setUp() {
        kit = new FanoutTestKit();
        kit.member("A", "Ann");
        kit.member("B", "Bee");
        kit.doc(CollectionNames.CRAGS, "{id:'c1', name:'Smith Rock', authorId:'B'}");
    }

    @Test
    void watchingOnlyAnnouncesTheRawSubscription() {
        Subscription sub = kit.manager.subscribe("A", "c1", SubscriptionMeta.of("crag", SubscriptionStyle.WATCH)).join();

        assertThat(sub.getId()).isNotBlank();
        assertThat(sub.style()).isEqualTo(SubscriptionStyle.WATCH);
        assertThat(kit.transport.all()).singleElement().satisfies(sent -> {
            assertThat(sent.channel()).isEqualTo("watch");
            assertThat(sent.topic()).isEqualTo("watch.new");
            assertThat(sent.payload().path("subscribee").path("name").asText()).isEqualTo("Smith Rock");
        });
        assertThat(kit.all(CollectionNames.EVENTS)).isEmpty();
        assertThat(kit.all(CollectionNames.NOTIFICATIONS)).isEmpty();
    }

    @Test
    void followingNotifiesTheFollowedMember() {
        Subscription sub = kit.manager.subscribe("A", "B", SubscriptionMeta.of("member", SubscriptionStyle.FOLLOW)).join();

        List<Notification> notes = kit.notifications.listBySubscription(sub.getId());
        assertThat(notes).singleElement().extracting(Notification::getSubscriberId).isEqualTo("B");

        assertThat(kit.transport.topicsTo("follow")).containsExactly("follow.new");
        assertThat(kit.transport.topicsTo("mem-A")).containsExactly(Topics.EVENT_NEW);
        assertThat(kit.transport.topicsTo("mem-B")).containsExactly(Topics.NOTIFICATION_NEW);

        ObjectNode event = kit.all(CollectionNames.EVENTS).get(0);
        assertThat(event.path("actionType").asText()).isEqualTo("follow");
        assertThat(event.path("actionId").asText()).isEqualTo(sub.getId());
        assertThat(event.path("data").path("action").path("i").asText()).isEqualTo("A");
        assertThat(event.path("data").path("action").path("t").asText()).isEqualTo("follow");
        assertThat(event.path("data").path("action").path("g").asText()).isEqualTo("g-A");
        assertThat(event.path("data").path("target").path("a").asText()).isEqualTo("Bee");
        assertThat(event.path("data").path("target").has("g")).isFalse();
    }

    @Test
    void requestingNotifiesTheRequestedMember() {
        Subscription sub = kit.manager.subscribe("A", "B", SubscriptionMeta.of("member", SubscriptionStyle.REQUEST)).join();

        assertThat(kit.notifications.listBySubscription(sub.getId()))
                .singleElement().extracting(Notification::getSubscriberId).isEqualTo("B");
        assertThat(kit.all(CollectionNames.EVENTS)).singleElement()
                .satisfies(e -> assertThat(e.path("actionType").asText()).isEqualTo("request"));
    }

    @Test
    void duplicateSubscribeReturnsTheExistingSubscriptionSilently() {
        Subscription first = kit.manager.subscribe("A", "B", SubscriptionMeta.of("member", SubscriptionStyle.FOLLOW)).join();
        int sent = kit.transport.all().size();

        Subscription second = kit.manager.subscribe("A", "B", SubscriptionMeta.of("member", SubscriptionStyle.FOLLOW)).join();

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(kit.transport.all()).hasSize(sent);
        assertThat(kit.all(CollectionNames.SUBSCRIPTIONS)).hasSize(1);
        assertThat(kit.notifications.listBySubscription(first.getId())).hasSize(1);
    }

    @Test
    void subscribingToAnUnknownPartyCreatesNothing() {
        assertThatThrownBy(() -> kit.manager.subscribe("A", "ghost", SubscriptionMeta.of("member", SubscriptionStyle.FOLLOW)).join())
                .hasCauseInstanceOf(FanoutNotFoundException.class);
        assertThatThrownBy(() -> kit.manager.subscribe("A", "B", null).join())
                .hasCauseInstanceOf(FanoutValidationException.class);

        assertThat(kit.all(CollectionNames.SUBSCRIPTIONS)).isEmpty();
        assertThat(kit.transport.all()).isEmpty();
    }

    @Test
    void acceptTurnsARequestIntoAFollowAndNotifiesBothSides() {
        Subscription request = kit.manager.subscribe("A", "B", SubscriptionMeta.of("member", SubscriptionStyle.REQUEST)).join();

        Subscription accepted = kit.manager.accept(request).join();

        assertThat(accepted.style()).isEqualTo(SubscriptionStyle.FOLLOW);
        assertThat(kit.subscriptions.findByPair("A", "B")).get()
                .extracting(Subscription::style).isEqualTo(SubscriptionStyle.FOLLOW);

        assertThat(kit.notifications.listBySubscription(request.getId()))
                .extracting(Notification::getSubscriberId)
                .containsExactlyInAnyOrder("B", "A", "B");
        assertThat(kit.transport.topicsTo("accept")).containsExactly("accept.new");
        assertThat(kit.transport.topicsTo("follow")).containsExactly("follow.new");

        ObjectNode acceptEvent = single("accept");
        assertThat(acceptEvent.path("actorId").asText()).isEqualTo("B");
        assertThat(acceptEvent.path("targetId").asText()).isEqualTo("A");

        ObjectNode followEvent = single("follow");
        String expected = DigestUtils.md5DigestAsHex("a@example.com".getBytes(StandardCharsets.UTF_8));
        assertThat(followEvent.path("actorId").asText()).isEqualTo("A");
        assertThat(followEvent.path("data").path("action").path("g").asText()).isEqualTo(expected);
    }

    @Test
    void acceptThatUpdatesNothingPublishesNothing() {
        Subscription request = kit.manager.subscribe("A", "B", SubscriptionMeta.of("member", SubscriptionStyle.REQUEST)).join();
        kit.manager.accept(request).join();
        int sent = kit.transport.all().size();
        int events = kit.all(CollectionNames.EVENTS).size();

        // second accept with the stale request
        assertThatThrownBy(() -> kit.manager.accept(request).join())
                .hasCauseInstanceOf(FanoutNotFoundException.class);

        assertThat(kit.transport.all()).hasSize(sent);
        assertThat(kit.all(CollectionNames.EVENTS)).hasSize(events);
    }

    @Test
    void onlyPendingRequestsCanBeAccepted() {
        Subscription follow = kit.manager.subscribe("A", "B", SubscriptionMeta.of("member", SubscriptionStyle.FOLLOW)).join();

        assertThatThrownBy(() -> kit.manager.accept(follow).join())
                .hasCauseInstanceOf(FanoutValidationException.class);
    }

    @Test
    void gravatarFallsBackToThePlaceholderAddress() {
        ObjectNode member = kit.json("{id:'X'}");

        assertThat(DefaultSubscriptionManager.emailHash(member))
                .isEqualTo(DigestUtils.md5DigestAsHex("foo@bar.baz".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void unsubscribingAnAbsentPairIsANoOp() {
        Optional<Subscription> removed = kit.manager.unsubscribe("A", "B").join();

        assertThat(removed).isEmpty();
        assertThat(kit.transport.all()).isEmpty();
    }

    @Test
    void unsubscribingAFollowClearsNotificationsAndTellsBothSides() {
        Subscription follow = kit.manager.subscribe("A", "B", SubscriptionMeta.of("member", SubscriptionStyle.FOLLOW)).join();
        Notification note = kit.notifications.listBySubscription(follow.getId()).get(0);
        kit.transport.clear();

        Optional<Subscription> removed = kit.manager.unsubscribe("A", "B").join();

        assertThat(removed).get().extracting(Subscription::getId).isEqualTo(follow.getId());
        assertThat(kit.subscriptions.findByPair("A", "B")).isEmpty();
        assertThat(kit.notifications.listBySubscription(follow.getId())).isEmpty();

        assertThat(kit.transport.topicsTo("mem-A")).containsExactly("follow.removed");
        assertThat(kit.transport.topicsTo("mem-B")).containsExactlyInAnyOrder("follow.removed", Topics.NOTIFICATION_REMOVED);
        assertThat(kit.transport.withTopic(Topics.NOTIFICATION_REMOVED)).singleElement()
                .satisfies(s -> assertThat(s.payload().path("id").asText()).isEqualTo(note.getId()));
        assertThat(kit.transport.withTopic("follow.removed"))
                .allSatisfy(s -> assertThat(s.payload().path("id").asText()).isEqualTo(follow.getId()));
    }

    @Test
    void unsubscribingAWatchOnlyTellsTheSubscriber() {
        kit.manager.subscribe("A", "c1", SubscriptionMeta.of("crag", SubscriptionStyle.WATCH)).join();
        kit.transport.clear();

        kit.manager.unsubscribe("A", "c1").join();

        assertThat(kit.transport.all()).singleElement().satisfies(s -> {
            assertThat(s.channel()).isEqualTo("mem-A");
            assertThat(s.topic()).isEqualTo("watch.removed");
        });
    }

    @Test
    void failedRemoveLeavesTheSubscriptionAndAnnouncesNothing() {
        Subscription follow = kit.manager.subscribe("A", "B", SubscriptionMeta.of("member", SubscriptionStyle.FOLLOW)).join();
        kit.transport.clear();
        kit.faults.failOn(FailingDocumentStore.Op.REMOVE, CollectionNames.SUBSCRIPTIONS);

        assertThatThrownBy(() -> kit.manager.unsubscribe("A", "B").join())
                .hasCauseInstanceOf(UpstreamException.class)
                .hasMessageContaining("remove subscription failed");

        assertThat(kit.transport.all()).isEmpty();
        assertThat(kit.subscriptions.findByPair("A", "B")).isPresent();
        assertThat(kit.notifications.listBySubscription(follow.getId())).hasSize(1);
    }

    @Test
    void failedNotificationLookupAnnouncesNothing() {
        kit.manager.subscribe("A", "B", SubscriptionMeta.of("member", SubscriptionStyle.FOLLOW)).join();
        kit.transport.clear();
        kit.faults.failOn(FailingDocumentStore.Op.LIST, CollectionNames.NOTIFICATIONS);

        assertThatThrownBy(() -> kit.manager.unsubscribe("A", "B").join())
                .hasCauseInstanceOf(UpstreamException.class)
                .hasMessageContaining("list notifications failed");

        assertThat(kit.transport.withTopic("follow.removed")).isEmpty();
        assertThat(kit.transport.withTopic(Topics.NOTIFICATION_REMOVED)).isEmpty();
        assertThat(kit.all(CollectionNames.NOTIFICATIONS)).hasSize(1);
    }

    private ObjectNode single(String actionType) {
        List<ObjectNode> found = kit.store.list(CollectionNames.EVENTS,
                DocumentQuery.where("actionType", actionType), ListOptions.none());
        assertThat(found).hasSize(1);
        return found.get(0);
    }
}
