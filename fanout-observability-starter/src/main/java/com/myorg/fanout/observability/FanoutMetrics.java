package com.myorg.fanout.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class FanoutMetrics {

    public static final String PUBLISH_SUCCESS = "fanout.publish.success";
    public static final String PUBLISH_FAIL = "fanout.publish.fail";
    public static final String EVENT_REJECTED = "fanout.event.rejected";
    public static final String NOTIFICATION_CREATED = "fanout.notification.created";
    public static final String PUBLISH_TIMER = "fanout.publish";

    // all private member channels share one tag value
    static final String PRIVATE_CHANNEL_TAG = "private";

    private final MeterRegistry registry;
    private final String serviceName;
    private final FanoutObservabilityProperties props;
    private final String privateChannelPrefix;

    private Counter cSuccess;
    private Counter cFail;
    private Counter cRejected;
    private Counter cNotifications;

    /** Call once on startup. */
    public void preRegisterBaseMeters() {
        cSuccess = Counter.builder(PUBLISH_SUCCESS).tag("service", serviceName).register(registry);
        cFail = Counter.builder(PUBLISH_FAIL).tag("service", serviceName).register(registry);
        cRejected = Counter.builder(EVENT_REJECTED).tag("service", serviceName).register(registry);
        cNotifications = Counter.builder(NOTIFICATION_CREATED).tag("service", serviceName).register(registry);
        Timer.builder(PUBLISH_TIMER).tag("service", serviceName).register(registry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopTimer(Timer.Sample sample, String channel, String outcome) {
        if (sample == null) return;

        Timer.Builder b = Timer.builder(PUBLISH_TIMER).tag("service", serviceName);
        if (props.isTagOutcome()) b.tag("outcome", outcome);
        if (props.isTagChannel() && channel != null) b.tag("channel", channelTag(channel));
        sample.stop(b.register(registry));
    }

    public void incSuccess() { counter(cSuccess, PUBLISH_SUCCESS).increment(); }
    public void incFail()    { counter(cFail, PUBLISH_FAIL).increment(); }
    public void incRejected() { counter(cRejected, EVENT_REJECTED).increment(); }

    public void addNotifications(int n) {
        if (n > 0) counter(cNotifications, NOTIFICATION_CREATED).increment(n);
    }

    private Counter counter(Counter preRegistered, String name) {
        return preRegistered != null ? preRegistered : registry.counter(name, "service", serviceName);
    }

    private String channelTag(String channel) {
        return privateChannelPrefix != null && !privateChannelPrefix.isEmpty() && channel.startsWith(privateChannelPrefix)
                ? PRIVATE_CHANNEL_TAG
                : channel;
    }
}
