package com.myorg.fanout.engine.hydrate;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * @param view     the event with its action (and nested content) joined in
 * @param rejected true when authorization vetoed the event
 */
public record HydratedEvent(ObjectNode view, boolean rejected) {
}
