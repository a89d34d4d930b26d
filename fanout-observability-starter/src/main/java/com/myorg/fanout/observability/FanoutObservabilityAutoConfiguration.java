package com.myorg.fanout.observability;

import com.myorg.fanout.engine.FanoutEngineProperties;
import com.myorg.fanout.engine.FanoutPublisher;
import com.myorg.fanout.engine.autoconfig.FanoutEngineAutoConfiguration;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

@AutoConfiguration(after = FanoutEngineAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(FanoutPublisher.class)
@EnableConfigurationProperties(FanoutObservabilityProperties.class)
public class FanoutObservabilityAutoConfiguration {

    @Bean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    public FanoutMetrics fanoutMetrics(MeterRegistry registry, Environment env,
                                       FanoutObservabilityProperties props,
                                       ObjectProvider<FanoutEngineProperties> engineProps) {
        String app = env.getProperty("spring.application.name", "unknown-service");
        FanoutEngineProperties engine = engineProps.getIfAvailable(FanoutEngineProperties::new);
        return new FanoutMetrics(registry, app, props, engine.getPrivateChannelPrefix());
    }

    /**
     * Pre-register meters at startup so /actuator/metrics/<name> never returns 404.
     */
    @Bean
    public SmartLifecycle fanoutMetricsPreRegisterLifecycle(
            FanoutObservabilityProperties props,
            ObjectProvider<FanoutMetrics> metricsProvider
    ) {
        return new SmartLifecycle() {
            private boolean running = false;

            @Override public void start() {
                if (props.isEnabled() && props.isMetricsEnabled()) {
                    FanoutMetrics m = metricsProvider.getIfAvailable();
                    if (m != null) m.preRegisterBaseMeters();
                }
                running = true;
            }

            @Override public void stop() { running = false; }
            @Override public boolean isRunning() { return running; }
            @Override public int getPhase() { return Integer.MIN_VALUE; } // start very early
        };
    }

    @Bean
    public static BeanPostProcessor observingFanoutPublisherBpp(
            ObjectProvider<FanoutObservabilityProperties> propsProvider,
            ObjectProvider<FanoutMetrics> metricsProvider
    ) {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (!(bean instanceof FanoutPublisher publisher)) return bean;
                if (bean instanceof ObservingFanoutPublisher) return bean;
                FanoutObservabilityProperties props = propsProvider.getIfAvailable(FanoutObservabilityProperties::new);
                if (!props.isEnabled()) return bean;

                return new ObservingFanoutPublisher(publisher, props, metricsProvider.getIfAvailable());
            }
        };
    }
}
