package com.myorg.fanout.engine.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.contracts.core.conventions.CollectionNames;
import com.myorg.fanout.contracts.core.conventions.Topics;
import com.myorg.fanout.contracts.model.Event;
import com.myorg.fanout.contracts.model.SubscriptionMeta;
import com.myorg.fanout.contracts.model.SubscriptionStyle;
import com.myorg.fanout.contracts.publish.PublishOptions;
import com.myorg.fanout.contracts.publish.PublishReceipt;
import com.myorg.fanout.contracts.publish.PublishRequest;
import com.myorg.fanout.contracts.publish.ResolutionMethod;
import com.myorg.fanout.engine.FanoutEngineProperties;
import com.myorg.fanout.engine.FanoutPublisher;
import com.myorg.fanout.engine.RecordingLiveTransport;
import com.myorg.fanout.engine.SubscriptionManager;
import com.myorg.fanout.engine.hydrate.HydratorRegistry;
import com.myorg.fanout.engine.resolve.DemandSubscriptionStrategy;
import com.myorg.fanout.engine.resolve.ResolutionStrategy;
import com.myorg.fanout.engine.store.DocumentQuery;
import com.myorg.fanout.engine.store.DocumentStore;
import com.myorg.fanout.engine.store.InMemoryDocumentStore;
import com.myorg.fanout.engine.transport.LiveTransport;
import com.myorg.fanout.engine.transport.RedisLiveTransport;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.FilteredClassLoader;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.mock.env.MockEnvironment;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;

class FanoutEngineAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    FanoutEngineRedisAutoConfiguration.class,
                    FanoutEngineAutoConfiguration.class))
            // không cần Redis thật cho phần lớn test
            .withPropertyValues("fanout.engine.transport.redis.enabled=false");

    @Test
    void wiresTheEngineOverTheInMemoryStore() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(FanoutPublisher.class);
            assertThat(ctx).hasSingleBean(SubscriptionManager.class);
            assertThat(ctx.getBean(DocumentStore.class)).isInstanceOf(InMemoryDocumentStore.class);
            assertThat(ctx).hasBean(FanoutEngineAutoConfiguration.EXECUTOR_BEAN);
            assertThat(ctx).doesNotHaveBean(LiveTransport.class);

            HydratorRegistry registry = ctx.getBean(HydratorRegistry.class);
            assertThat(registry.get("post")).isNotNull();
            assertThat(registry.get("session")).isNotNull();
            assertThat(registry.get("dataset")).isNull();
        });
    }

    @Test
    void datasetDomainSwapsTheHydrators() {
        runner.withPropertyValues("fanout.engine.domain=dataset").run(ctx -> {
            HydratorRegistry registry = ctx.getBean(HydratorRegistry.class);
            assertThat(registry.get("dataset")).isNotNull();
            assertThat(registry.get("note")).isNotNull();
            assertThat(registry.get("post")).isNull();
        });
    }

    @Test
    void noneDomainRegistersNothing() {
        runner.withPropertyValues("fanout.engine.domain=none").run(ctx -> {
            HydratorRegistry registry = ctx.getBean(HydratorRegistry.class);
            assertThat(registry.get("post")).isNull();
            assertThat(registry.get("dataset")).isNull();
        });
    }

    @Test
    void applicationStoreWins() {
        runner.withUserConfiguration(CustomStoreConfig.class).run(ctx ->
                assertThat(ctx.getBean(DocumentStore.class)).isSameAs(ctx.getBean("customStore")));
    }

    @Test
    void applicationResolutionStrategyReplacesTheBuiltIn() {
        runner.withUserConfiguration(CountingStrategyConfig.class).run(ctx -> {
            DocumentStore store = ctx.getBean(DocumentStore.class);
            ObjectMapper mapper = new ObjectMapper();
            store.create(CollectionNames.MEMBERS, member(mapper, "B", "Bee"));
            store.create(CollectionNames.POSTS, mapper.createObjectNode().put("id", "p1").put("authorId", "B"));

            PublishRequest request = PublishRequest.builder()
                    .data(mapper.createObjectNode().put("id", "p1").put("authorId", "B"))
                    .event(Event.builder().actorId("B").actionId("p1").actionType("post").build())
                    .options(PublishOptions.method(ResolutionMethod.DEMAND_SUBSCRIPTION))
                    .build();
            PublishReceipt receipt = ctx.getBean(FanoutPublisher.class).publish("post", "post.new", request).get();

            assertThat(receipt.rejected()).isFalse();
            assertThat(ctx.getBean(CountingStrategyConfig.class).calls).hasValue(1);
        });
    }

    @Test
    void propertiesBind() {
        runner.withPropertyValues(
                        "fanout.engine.default-method=with-subscription",
                        "fanout.engine.private-channel-prefix=user-",
                        "fanout.engine.hydration.comment-limit=3",
                        "fanout.engine.email.delivery=on")
                .run(ctx -> {
                    FanoutEngineProperties props = ctx.getBean(FanoutEngineProperties.class);
                    assertThat(props.getDefaultMethod().name()).isEqualTo("WITH_SUBSCRIPTION");
                    assertThat(props.getPrivateChannelPrefix()).isEqualTo("user-");
                    assertThat(props.getHydration().getCommentLimit()).isEqualTo(3);
                    assertThat(props.getEmail().getDelivery()).isEqualTo(FanoutEngineProperties.EmailDelivery.ON);
                });
    }

    @Test
    void autoEmailDeliveryFollowsTheProductionProfile() {
        MockEnvironment dev = new MockEnvironment();
        MockEnvironment prod = new MockEnvironment();
        prod.setActiveProfiles("cloud", "prod");

        assertThat(FanoutEngineAutoConfiguration.emailDeliveryEnabled(FanoutEngineProperties.EmailDelivery.AUTO, dev)).isFalse();
        assertThat(FanoutEngineAutoConfiguration.emailDeliveryEnabled(FanoutEngineProperties.EmailDelivery.AUTO, prod)).isTrue();
        assertThat(FanoutEngineAutoConfiguration.emailDeliveryEnabled(FanoutEngineProperties.EmailDelivery.ON, dev)).isTrue();
        assertThat(FanoutEngineAutoConfiguration.emailDeliveryEnabled(FanoutEngineProperties.EmailDelivery.OFF, prod)).isFalse();
    }

    @Test
    void followFlowsThroughTheWorkerPool() {
        runner.withUserConfiguration(RecordingTransportConfig.class).run(ctx -> {
            DocumentStore store = ctx.getBean(DocumentStore.class);
            ObjectMapper mapper = new ObjectMapper();
            store.create(CollectionNames.MEMBERS, member(mapper, "A", "Ann"));
            store.create(CollectionNames.MEMBERS, member(mapper, "B", "Bee"));

            ctx.getBean(SubscriptionManager.class)
                    .subscribe("A", "B", SubscriptionMeta.of("member", SubscriptionStyle.FOLLOW))
                    .get();

            RecordingLiveTransport transport = ctx.getBean(RecordingLiveTransport.class);
            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
                assertThat(transport.topicsTo("follow")).containsExactly("follow.new");
                assertThat(transport.topicsTo("mem-B")).contains(Topics.NOTIFICATION_NEW);
            });
        });
    }

    @Test
    void redisTransportBacksOffWhenDisabledOrMissing() {
        runner.withPropertyValues("fanout.engine.transport.redis.enabled=false")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(RedisLiveTransport.class));

        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        FanoutEngineRedisAutoConfiguration.class,
                        FanoutEngineAutoConfiguration.class))
                .withClassLoader(new FilteredClassLoader(RedisConnectionFactory.class))
                .run(ctx -> {
                    assertThat(ctx).hasNotFailed();
                    assertThat(ctx).doesNotHaveBean(LiveTransport.class);
                });
    }

    @Test
    void redisTransportUsesTheApplicationConnectionFactory() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        FanoutEngineRedisAutoConfiguration.class,
                        FanoutEngineAutoConfiguration.class))
                .withBean(RedisConnectionFactory.class, () -> mock(RedisConnectionFactory.class))
                .run(ctx -> {
                    assertThat(ctx).getBean(LiveTransport.class).isInstanceOf(RedisLiveTransport.class);
                    assertThat(ctx).hasSingleBean(RedisConnectionFactory.class);
                });
    }

    private static ObjectNode member(ObjectMapper mapper, String id, String name) {
        return mapper.createObjectNode()
                .put("id", id)
                .put("displayName", name)
                .put("primaryEmail", id.toLowerCase() + "@example.com");
    }

    @Configuration
    static class CustomStoreConfig {
        @Bean
        DocumentStore customStore() {
            return new InMemoryDocumentStore();
        }
    }

    @Configuration
    static class CountingStrategyConfig {
        final AtomicInteger calls = new AtomicInteger();

        @Bean
        ResolutionStrategy countingDemandStrategy() {
            DemandSubscriptionStrategy builtIn = new DemandSubscriptionStrategy();
            return new ResolutionStrategy() {
                @Override
                public ResolutionMethod method() {
                    return ResolutionMethod.DEMAND_SUBSCRIPTION;
                }

                @Override
                public Optional<DocumentQuery> query(Event event, PublishOptions options) {
                    calls.incrementAndGet();
                    return builtIn.query(event, options);
                }
            };
        }
    }

    @Configuration
    static class RecordingTransportConfig {
        @Bean
        RecordingLiveTransport recordingLiveTransport() {
            return new RecordingLiveTransport();
        }
    }
}
