package com.myorg.fanout.engine.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.contracts.core.conventions.CollectionNames;
import com.myorg.fanout.contracts.core.exception.DuplicateSubscriptionException;
import com.myorg.fanout.contracts.model.Subscription;
import com.myorg.fanout.contracts.model.SubscriptionStyle;

import java.util.List;
import java.util.Optional;

public class DocumentSubscriptionStore implements SubscriptionStore {

    private final DocumentStore store;
    private final ObjectMapper mapper;

    public DocumentSubscriptionStore(DocumentStore store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public Subscription create(Subscription subscription) {
        try {
            ObjectNode saved = store.create(CollectionNames.SUBSCRIPTIONS, mapper.valueToTree(subscription));
            return mapper.convertValue(saved, Subscription.class);
        } catch (DuplicateDocumentException e) {
            throw new DuplicateSubscriptionException(subscription.getSubscriberId(), subscription.getSubscribeeId(), e);
        }
    }

    @Override
    public Optional<Subscription> findByPair(String subscriberId, String subscribeeId) {
        return store.read(CollectionNames.SUBSCRIPTIONS,
                DocumentQuery.where("subscriberId", subscriberId).and("subscribeeId", subscribeeId))
                .map(this::toSubscription);
    }

    @Override
    public List<Subscription> list(DocumentQuery query) {
        return store.list(CollectionNames.SUBSCRIPTIONS, query, ListOptions.none()).stream()
                .map(this::toSubscription)
                .toList();
    }

    @Override
    public int updateStyle(String id, SubscriptionStyle expected, SubscriptionStyle next) {
        ObjectNode set = mapper.createObjectNode().put("meta.style", next.wireName());
        return store.update(CollectionNames.SUBSCRIPTIONS,
                DocumentQuery.byId(id).and("meta.style", expected.wireName()), set);
    }

    @Override
    public int remove(String id) {
        return store.remove(CollectionNames.SUBSCRIPTIONS, DocumentQuery.byId(id));
    }

    private Subscription toSubscription(ObjectNode doc) {
        return mapper.convertValue(doc, Subscription.class);
    }
}
