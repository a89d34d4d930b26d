package com.myorg.fanout.engine.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

// Publishes live messages on one Redis pub/sub channel; gateways split on the first two spaces.
@Slf4j
@RequiredArgsConstructor
public class RedisLiveTransport implements LiveTransport {

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final String redisChannel;

    @Override
    public void send(String channel, String topic, JsonNode payload) {
        redis.convertAndSend(redisChannel, LiveMessage.format(mapper, channel, topic, payload));
        log.debug("Live message sent channel={} topic={}", channel, topic);
    }
}
