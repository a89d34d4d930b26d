package com.myorg.fanout.engine.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.contracts.model.Event;

import java.util.Optional;

public interface EventStore {

    Event create(Event event);

    Optional<Event> findById(String id);

    /**
     * @return number of records updated
     */
    int update(String id, ObjectNode patch);
}
