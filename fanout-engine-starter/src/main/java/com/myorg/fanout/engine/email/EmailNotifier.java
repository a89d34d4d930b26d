package com.myorg.fanout.engine.email;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.fanout.contracts.model.Member;
import com.myorg.fanout.contracts.model.Notification;

import java.util.concurrent.CompletableFuture;

/**
 * Sends an email copy of a notification. Results are observed only for logging.
 */
public interface EmailNotifier {

    /**
     * @param body optional free-form content from the published data, may be null
     */
    CompletableFuture<Void> notify(Member recipient, Notification notification, JsonNode body);
}
