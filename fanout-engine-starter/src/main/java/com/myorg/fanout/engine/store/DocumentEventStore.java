package com.myorg.fanout.engine.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.contracts.core.conventions.CollectionNames;
import com.myorg.fanout.contracts.model.Event;

import java.util.Optional;

public class DocumentEventStore implements EventStore {

    private final DocumentStore store;
    private final ObjectMapper mapper;

    public DocumentEventStore(DocumentStore store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public Event create(Event event) {
        ObjectNode saved = store.create(CollectionNames.EVENTS, mapper.valueToTree(event));
        return mapper.convertValue(saved, Event.class);
    }

    @Override
    public Optional<Event> findById(String id) {
        return store.read(CollectionNames.EVENTS, DocumentQuery.byId(id))
                .map(doc -> mapper.convertValue(doc, Event.class));
    }

    @Override
    public int update(String id, ObjectNode patch) {
        if (patch == null || patch.isEmpty()) {
            return findById(id).isPresent() ? 1 : 0;
        }
        ObjectNode set = patch.deepCopy();
        set.remove("id");
        return store.update(CollectionNames.EVENTS, DocumentQuery.byId(id), set);
    }
}
