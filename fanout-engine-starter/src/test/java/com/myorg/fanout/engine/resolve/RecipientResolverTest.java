package com.myorg.fanout.engine.resolve;

import com.myorg.fanout.contracts.core.exception.UnknownResolutionMethodException;
import com.myorg.fanout.contracts.model.Event;
import com.myorg.fanout.contracts.model.Subscription;
import com.myorg.fanout.contracts.model.SubscriptionStyle;
import com.myorg.fanout.contracts.publish.PublishOptions;
import com.myorg.fanout.contracts.publish.ResolutionMethod;
import com.myorg.fanout.engine.FanoutTestKit;
import com.myorg.fanout.engine.store.DocumentQuery;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecipientResolverTest {

    private final FanoutTestKit kit = new FanoutTestKit();

    @Test
    void demandSubscriptionUnitesFollowersAndWatchers() {
        kit.member("A", "Ann");
        kit.member("B", "Bee");
        kit.member("C", "Cee");
        kit.member("D", "Dee");
        kit.subscription("A", "B", "member", SubscriptionStyle.FOLLOW);
        kit.subscription("C", "p1", "post", SubscriptionStyle.WATCH);
        kit.subscription("D", "B", "member", SubscriptionStyle.REQUEST);
        Subscription muted = kit.subscription("D", "p1", "post", SubscriptionStyle.WATCH);
        kit.store.update("subscriptions", DocumentQuery.byId(muted.getId()),
                kit.json("{mute:true}"));

        List<Recipient> recipients = kit.resolver.resolve(event("B", "p1"), ResolutionMethod.DEMAND_SUBSCRIPTION,
                new PublishOptions(), false).join();

        assertThat(recipients).extracting(r -> r.getSubscription().getSubscriberId())
                .containsExactlyInAnyOrder("A", "C");
        assertThat(recipients).allSatisfy(r -> {
            assertThat(r.getSubscriber().getPrimaryEmail()).endsWith("@example.com");
            assertThat(r.getSubscribee()).isNull();
        });
    }

    @Test
    void withSubscriptionJoinsTheSubscribeeOnRequest() {
        kit.member("A", "Ann");
        kit.member("B", "Bee");
        Subscription sub = kit.subscription("A", "B", "member", SubscriptionStyle.REQUEST);

        List<Recipient> recipients = kit.resolver.resolve(event("A", "B"), ResolutionMethod.WITH_SUBSCRIPTION,
                PublishOptions.withSubscription(sub.getId()), true).join();

        assertThat(recipients).singleElement().satisfies(r ->
                assertThat(r.getSubscribee().getDisplayName()).isEqualTo("Bee"));
    }

    @Test
    void unknownSubscriberIsDropped() {
        kit.member("B", "Bee");
        kit.subscription("ghost", "B", "member", SubscriptionStyle.FOLLOW);

        assertThat(kit.resolver.resolve(event("B", null), ResolutionMethod.DEMAND_SUBSCRIPTION,
                new PublishOptions(), false).join()).isEmpty();
    }

    @Test
    void emptyQueryResolvesToNobody() {
        assertThat(kit.resolver.resolve(event("B", null), ResolutionMethod.WITH_SUBSCRIPTION,
                new PublishOptions(), false).join()).isEmpty();
    }

    @Test
    void unregisteredMethodFails() {
        RecipientResolver partial = new RecipientResolver(List.of(new WithSubscriptionStrategy()),
                kit.subscriptions, kit.joiner, kit.access, kit.mapper, kit.executor);

        assertThatThrownBy(() -> partial.resolve(event("B", null), ResolutionMethod.DEMAND_SUBSCRIPTION,
                new PublishOptions(), false).join())
                .hasCauseInstanceOf(UnknownResolutionMethodException.class);
    }

    @Test
    void firstStrategyForAMethodIsKept() {
        kit.member("A", "Ann");
        kit.member("C", "Cee");
        kit.subscription("A", "B", "member", SubscriptionStyle.FOLLOW);
        kit.subscription("C", "B", "member", SubscriptionStyle.WATCH);
        ResolutionStrategy watchersOnly = new ResolutionStrategy() {
            @Override
            public ResolutionMethod method() {
                return ResolutionMethod.DEMAND_SUBSCRIPTION;
            }

            @Override
            public Optional<DocumentQuery> query(Event event, PublishOptions options) {
                return Optional.of(SubscriptionQueries.active(event.getActorId(), SubscriptionStyle.WATCH));
            }
        };
        RecipientResolver resolver = new RecipientResolver(List.of(watchersOnly, new DemandSubscriptionStrategy()),
                kit.subscriptions, kit.joiner, kit.access, kit.mapper, kit.executor);

        List<Recipient> recipients = resolver.resolve(event("B", null), ResolutionMethod.DEMAND_SUBSCRIPTION,
                new PublishOptions(), false).join();

        assertThat(recipients).extracting(r -> r.getSubscription().getSubscriberId()).containsExactly("C");
    }

    private static Event event(String actorId, String targetId) {
        return Event.builder().id("e1").actorId(actorId).targetId(targetId).actionId("x").actionType("post").build();
    }
}
