package com.myorg.fanout.engine.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Pushes a message to clients connected on a channel. Fire-and-forget: no acknowledgement.
 */
public interface LiveTransport {
    void send(String channel, String topic, JsonNode payload);
}
