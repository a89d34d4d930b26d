package com.myorg.fanout.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.fanout.engine.transport.LiveTransport;

import java.util.ArrayList;
import java.util.List;

public class RecordingLiveTransport implements LiveTransport {

    public record Sent(String channel, String topic, JsonNode payload) {}

    private final List<Sent> sent = new ArrayList<>();

    @Override
    public synchronized void send(String channel, String topic, JsonNode payload) {
        sent.add(new Sent(channel, topic, payload.deepCopy()));
    }

    public synchronized List<Sent> all() {
        return List.copyOf(sent);
    }

    public synchronized List<Sent> to(String channel) {
        return sent.stream().filter(s -> s.channel().equals(channel)).toList();
    }

    public synchronized List<Sent> withTopic(String topic) {
        return sent.stream().filter(s -> s.topic().equals(topic)).toList();
    }

    public synchronized List<String> topicsTo(String channel) {
        return to(channel).stream().map(Sent::topic).toList();
    }

    public synchronized void clear() {
        sent.clear();
    }
}
