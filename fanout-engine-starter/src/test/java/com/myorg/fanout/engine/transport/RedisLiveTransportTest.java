package com.myorg.fanout.engine.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RedisLiveTransportTest {

    @Test
    void publishesSingleLineMessageOnTheRelayChannel() {
        ObjectMapper mapper = new ObjectMapper();
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        RedisLiveTransport transport = new RedisLiveTransport(redis, mapper, "fanout:live");

        transport.send("mem-A", "event.new", mapper.createObjectNode().put("id", "e1"));

        verify(redis).convertAndSend("fanout:live", "mem-A event.new {\"id\":\"e1\"}");
    }
}
