package com.myorg.fanout.engine;

import com.myorg.fanout.contracts.publish.PublishReceipt;
import com.myorg.fanout.contracts.publish.PublishRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Single fan-out entry point: raw live message, optional event record, recipient resolution,
 * hydration and notification dispatch.
 */
public interface FanoutPublisher {
    CompletableFuture<PublishReceipt> publish(String channel, String topic, PublishRequest request);
}
