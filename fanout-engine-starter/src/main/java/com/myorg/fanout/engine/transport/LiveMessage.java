package com.myorg.fanout.engine.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.fanout.contracts.core.exception.FanoutException;

/**
 * Single-line wire form relayed to socket gateways: {@code <channel> <topic> <json>}.
 */
public final class LiveMessage {
    private LiveMessage() {}

    public static String format(ObjectMapper mapper, String channel, String topic, JsonNode payload) {
        try {
            return channel + " " + topic + " " + mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new FanoutException("SERIALIZATION", "Cannot serialize payload for " + topic, e);
        }
    }
}
