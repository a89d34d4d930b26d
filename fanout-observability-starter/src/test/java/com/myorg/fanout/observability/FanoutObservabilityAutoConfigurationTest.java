package com.myorg.fanout.observability;

import com.myorg.fanout.engine.FanoutPublisher;
import com.myorg.fanout.engine.autoconfig.FanoutEngineAutoConfiguration;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class FanoutObservabilityAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    FanoutEngineAutoConfiguration.class,
                    FanoutObservabilityAutoConfiguration.class))
            .withPropertyValues("spring.application.name=fanout-test")
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new);

    @Test
    void publisherIsWrappedAndMetersPreRegistered() {
        runner.run(ctx -> {
            assertThat(ctx.getBean(FanoutPublisher.class)).isInstanceOf(ObservingFanoutPublisher.class);
            assertThat(ctx).hasSingleBean(FanoutMetrics.class);

            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertThat(registry.find(FanoutMetrics.PUBLISH_SUCCESS).tag("service", "fanout-test").counter()).isNotNull();
            assertThat(registry.find(FanoutMetrics.EVENT_REJECTED).counter()).isNotNull();
        });
    }

    @Test
    void disabledLeavesThePublisherAlone() {
        runner.withPropertyValues("fanout.observability.enabled=false").run(ctx ->
                assertThat(ctx.getBean(FanoutPublisher.class)).isNotInstanceOf(ObservingFanoutPublisher.class));
    }

    @Test
    void noMetricsWithoutARegistry() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        FanoutEngineAutoConfiguration.class,
                        FanoutObservabilityAutoConfiguration.class))
                .run(ctx -> {
                    assertThat(ctx).doesNotHaveBean(FanoutMetrics.class);
                    assertThat(ctx.getBean(FanoutPublisher.class)).isInstanceOf(ObservingFanoutPublisher.class);
                });
    }
}
