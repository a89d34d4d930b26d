package com.myorg.fanout.engine.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.fanout.contracts.core.conventions.CollectionNames;
import com.myorg.fanout.engine.DefaultFanoutPublisher;
import com.myorg.fanout.engine.DefaultSubscriptionManager;
import com.myorg.fanout.engine.FanoutEngineProperties;
import com.myorg.fanout.engine.FanoutPublisher;
import com.myorg.fanout.engine.SubscriptionManager;
import com.myorg.fanout.engine.access.AccessPredicate;
import com.myorg.fanout.engine.access.VisibilityAccessPredicate;
import com.myorg.fanout.engine.dispatch.NotificationDispatcher;
import com.myorg.fanout.engine.email.EmailNotifier;
import com.myorg.fanout.engine.hydrate.HydrationEngine;
import com.myorg.fanout.engine.hydrate.HydrationSupport;
import com.myorg.fanout.engine.hydrate.HydratorRegistry;
import com.myorg.fanout.engine.hydrate.ParentedActionHydrator;
import com.myorg.fanout.engine.hydrate.VariantHydrator;
import com.myorg.fanout.engine.hydrate.climbing.AscentHydrator;
import com.myorg.fanout.engine.hydrate.climbing.CragHydrator;
import com.myorg.fanout.engine.hydrate.climbing.PostHydrator;
import com.myorg.fanout.engine.hydrate.climbing.SessionHydrator;
import com.myorg.fanout.engine.hydrate.climbing.TickHydrator;
import com.myorg.fanout.engine.hydrate.dataset.DatasetHydrator;
import com.myorg.fanout.engine.hydrate.dataset.ViewHydrator;
import com.myorg.fanout.engine.join.DocumentJoiner;
import com.myorg.fanout.engine.join.Joiner;
import com.myorg.fanout.engine.resolve.DemandSubscriptionStrategy;
import com.myorg.fanout.engine.resolve.DemandWatchFromAuthorStrategy;
import com.myorg.fanout.engine.resolve.DemandWatchSubscriptionStrategy;
import com.myorg.fanout.engine.resolve.RecipientResolver;
import com.myorg.fanout.engine.resolve.ResolutionStrategy;
import com.myorg.fanout.engine.resolve.WithSubscriptionStrategy;
import com.myorg.fanout.engine.store.DocumentEventStore;
import com.myorg.fanout.engine.store.DocumentNotificationStore;
import com.myorg.fanout.engine.store.DocumentStore;
import com.myorg.fanout.engine.store.DocumentSubscriptionStore;
import com.myorg.fanout.engine.store.EventStore;
import com.myorg.fanout.engine.store.InMemoryDocumentStore;
import com.myorg.fanout.engine.store.NotificationStore;
import com.myorg.fanout.engine.store.SubscriptionStore;
import com.myorg.fanout.engine.transport.LiveTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(FanoutEngineProperties.class)
public class FanoutEngineAutoConfiguration {

    public static final String EXECUTOR_BEAN = "fanoutTaskExecutor";

    @Bean(name = EXECUTOR_BEAN)
    @ConditionalOnMissingBean(name = EXECUTOR_BEAN)
    public ThreadPoolTaskExecutor fanoutTaskExecutor(FanoutEngineProperties props) {
        var cfg = props.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getCoreSize());
        executor.setMaxPoolSize(cfg.getMaxSize());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix(cfg.getThreadNamePrefix());
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    // ---------------- stores ----------------

    @Bean
    @ConditionalOnMissingBean
    public DocumentStore fanoutDocumentStore() {
        log.warn("No DocumentStore bean found; using in-memory store (single instance, data lost on restart)");
        return new InMemoryDocumentStore()
                .uniqueIndex(CollectionNames.SUBSCRIPTIONS, "subscriberId", "subscribeeId");
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionStore fanoutSubscriptionStore(DocumentStore store, ObjectProvider<ObjectMapper> mapper) {
        return new DocumentSubscriptionStore(store, mapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public EventStore fanoutEventStore(DocumentStore store, ObjectProvider<ObjectMapper> mapper) {
        return new DocumentEventStore(store, mapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationStore fanoutNotificationStore(DocumentStore store, ObjectProvider<ObjectMapper> mapper) {
        return new DocumentNotificationStore(store, mapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public Joiner fanoutJoiner(DocumentStore store, ObjectProvider<ObjectMapper> mapper) {
        return new DocumentJoiner(store, mapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessPredicate fanoutAccessPredicate() {
        return new VisibilityAccessPredicate();
    }

    // ---------------- recipient resolution ----------------

    @Bean
    public ResolutionStrategy demandSubscriptionStrategy() {
        return new DemandSubscriptionStrategy();
    }

    @Bean
    public ResolutionStrategy demandWatchSubscriptionStrategy() {
        return new DemandWatchSubscriptionStrategy();
    }

    @Bean
    public ResolutionStrategy demandWatchFromAuthorStrategy() {
        return new DemandWatchFromAuthorStrategy();
    }

    @Bean
    public ResolutionStrategy withSubscriptionStrategy() {
        return new WithSubscriptionStrategy();
    }

    @Bean
    @ConditionalOnMissingBean
    public RecipientResolver recipientResolver(List<ResolutionStrategy> strategies,
                                               SubscriptionStore subscriptions,
                                               Joiner joiner,
                                               AccessPredicate access,
                                               ObjectProvider<ObjectMapper> mapper,
                                               @Qualifier(EXECUTOR_BEAN) Executor executor) {
        return new RecipientResolver(strategies, subscriptions, joiner, access,
                mapper.getIfAvailable(ObjectMapper::new), executor);
    }

    // ---------------- hydration ----------------

    @Bean
    @ConditionalOnMissingBean
    public HydrationSupport hydrationSupport(Joiner joiner, AccessPredicate access,
                                             @Qualifier(EXECUTOR_BEAN) Executor executor,
                                             FanoutEngineProperties props) {
        return new HydrationSupport(joiner, access, executor, props.getHydration().getCommentLimit());
    }

    @Bean
    @ConditionalOnMissingBean
    public HydratorRegistry hydratorRegistry(ObjectProvider<VariantHydrator> hydrators) {
        List<VariantHydrator> all = hydrators.orderedStream().toList();
        log.info("Hydrators registered: {}", all.stream().map(VariantHydrator::actionType)
                .collect(Collectors.joining(",")));
        return new HydratorRegistry(all);
    }

    @Bean
    @ConditionalOnMissingBean
    public HydrationEngine hydrationEngine(HydratorRegistry registry, Joiner joiner,
                                           ObjectProvider<ObjectMapper> mapper,
                                           @Qualifier(EXECUTOR_BEAN) Executor executor,
                                           FanoutEngineProperties props) {
        return new HydrationEngine(registry, joiner, mapper.getIfAvailable(ObjectMapper::new), executor,
                props.getHydration().isAuthorize());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "fanout.engine", name = "domain", havingValue = "climbing", matchIfMissing = true)
    static class ClimbingHydratorsConfig {

        @Bean
        VariantHydrator postHydrator(HydrationSupport support) {
            return new PostHydrator(support);
        }

        @Bean
        VariantHydrator sessionHydrator(HydrationSupport support) {
            return new SessionHydrator(support);
        }

        @Bean
        VariantHydrator tickHydrator(HydrationSupport support) {
            return new TickHydrator(support);
        }

        @Bean
        VariantHydrator cragHydrator(HydrationSupport support) {
            return new CragHydrator(support);
        }

        @Bean
        VariantHydrator ascentHydrator(HydrationSupport support) {
            return new AscentHydrator(support);
        }

        @Bean
        VariantHydrator hangtenHydrator(HydrationSupport support) {
            return new ParentedActionHydrator(support, "hangten", Set.of("post", "tick"));
        }

        @Bean
        VariantHydrator commentHydrator(HydrationSupport support) {
            return new ParentedActionHydrator(support, "comment", Set.of("post", "tick"));
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "fanout.engine", name = "domain", havingValue = "dataset")
    static class DatasetHydratorsConfig {

        @Bean
        VariantHydrator datasetHydrator(HydrationSupport support) {
            return new DatasetHydrator(support);
        }

        @Bean
        VariantHydrator viewHydrator(HydrationSupport support) {
            return new ViewHydrator(support);
        }

        @Bean
        VariantHydrator noteHydrator(HydrationSupport support) {
            return new ParentedActionHydrator(support, "note", Set.of("dataset", "view"));
        }

        @Bean
        VariantHydrator datasetCommentHydrator(HydrationSupport support) {
            return new ParentedActionHydrator(support, "comment", Set.of("dataset", "view"));
        }
    }

    // ---------------- dispatch & publish ----------------

    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher(NotificationStore notifications,
                                                         ObjectProvider<LiveTransport> transport,
                                                         ObjectProvider<EmailNotifier> emailNotifier,
                                                         ObjectProvider<ObjectMapper> mapper,
                                                         @Qualifier(EXECUTOR_BEAN) Executor executor,
                                                         FanoutEngineProperties props,
                                                         Environment env) {
        boolean emailDelivery = emailDeliveryEnabled(props.getEmail().getDelivery(), env);
        log.info("Email delivery mode={} enabled={}", props.getEmail().getDelivery(), emailDelivery);
        return new NotificationDispatcher(notifications, transport.getIfAvailable(), emailNotifier.getIfAvailable(),
                emailDelivery, props.getPrivateChannelPrefix(), mapper.getIfAvailable(ObjectMapper::new), executor);
    }

    @Bean
    @ConditionalOnMissingBean
    public FanoutPublisher fanoutPublisher(EventStore events,
                                           RecipientResolver resolver,
                                           HydrationEngine hydration,
                                           NotificationDispatcher dispatcher,
                                           ObjectProvider<LiveTransport> transport,
                                           @Qualifier(EXECUTOR_BEAN) Executor executor,
                                           FanoutEngineProperties props) {
        return new DefaultFanoutPublisher(events, resolver, hydration, dispatcher,
                transport.getIfAvailable(), executor, props);
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionManager subscriptionManager(SubscriptionStore subscriptions,
                                                   NotificationStore notifications,
                                                   Joiner joiner,
                                                   FanoutPublisher publisher,
                                                   ObjectProvider<ObjectMapper> mapper,
                                                   @Qualifier(EXECUTOR_BEAN) Executor executor,
                                                   FanoutEngineProperties props) {
        return new DefaultSubscriptionManager(subscriptions, notifications, joiner, publisher,
                mapper.getIfAvailable(ObjectMapper::new), executor, props);
    }

    static boolean emailDeliveryEnabled(FanoutEngineProperties.EmailDelivery mode, Environment env) {
        if (mode == FanoutEngineProperties.EmailDelivery.ON) return true;
        if (mode == FanoutEngineProperties.EmailDelivery.OFF) return false;
        for (String p : env.getActiveProfiles()) {
            if ("prod".equalsIgnoreCase(p) || "production".equalsIgnoreCase(p)) {
                return true;
            }
        }
        return false;
    }
}
