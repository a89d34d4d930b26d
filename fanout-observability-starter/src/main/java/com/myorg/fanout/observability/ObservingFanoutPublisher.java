package com.myorg.fanout.observability;

import com.myorg.fanout.contracts.publish.PublishReceipt;
import com.myorg.fanout.contracts.publish.PublishRequest;
import com.myorg.fanout.engine.FanoutPublisher;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.CompletableFuture;

/**
 * Wraps a {@link FanoutPublisher}: MDC for the synchronous part of the call (worker threads
 * inherit it through the engine executor), metrics when the returned future completes.
 */
@RequiredArgsConstructor
public class ObservingFanoutPublisher implements FanoutPublisher {

    private final FanoutPublisher delegate;
    private final FanoutObservabilityProperties props;
    private final FanoutMetrics metrics; // can be null if metrics disabled

    @Override
    public CompletableFuture<PublishReceipt> publish(String channel, String topic, PublishRequest request) {
        if (props.isMdcEnabled()) {
            FanoutMdc.put(channel, topic, eventType(request));
        }

        boolean measure = metrics != null && props.isMetricsEnabled();
        Timer.Sample sample = measure ? metrics.startTimer() : null;

        CompletableFuture<PublishReceipt> result;
        try {
            result = delegate.publish(channel, topic, request);
        } catch (RuntimeException e) {
            if (measure) {
                metrics.incFail();
                metrics.stopTimer(sample, channel, "fail");
            }
            throw e;
        } finally {
            if (props.isMdcEnabled()) {
                FanoutMdc.clear();
            }
        }

        if (!measure) return result;
        return result.whenComplete((receipt, e) -> {
            if (e != null) {
                metrics.incFail();
                metrics.stopTimer(sample, channel, "fail");
                return;
            }
            if (receipt.rejected()) {
                metrics.incRejected();
            } else {
                metrics.incSuccess();
                metrics.addNotifications(receipt.notifications());
            }
            metrics.stopTimer(sample, channel, receipt.outcome());
        });
    }

    private static String eventType(PublishRequest request) {
        return request != null && request.getEvent() != null ? request.getEvent().getActionType() : null;
    }
}
