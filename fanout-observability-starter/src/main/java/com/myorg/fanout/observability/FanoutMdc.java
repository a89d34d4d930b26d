package com.myorg.fanout.observability;

import org.slf4j.MDC;

public final class FanoutMdc {
    public static final String CHANNEL = "fanoutChannel";
    public static final String TOPIC = "fanoutTopic";
    public static final String EVENT_TYPE = "eventType";

    private FanoutMdc() {}

    public static void put(String channel, String topic, String eventType) {
        if (channel != null) MDC.put(CHANNEL, channel);
        if (topic != null) MDC.put(TOPIC, topic);
        if (eventType != null) MDC.put(EVENT_TYPE, eventType);
    }

    public static void clear() {
        MDC.remove(CHANNEL);
        MDC.remove(TOPIC);
        MDC.remove(EVENT_TYPE);
    }
}
