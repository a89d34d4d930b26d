package com.myorg.fanout.engine.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.fanout.contracts.core.conventions.CollectionNames;
import com.myorg.fanout.contracts.model.Notification;

import java.util.List;

public class DocumentNotificationStore implements NotificationStore {

    private final DocumentStore store;
    private final ObjectMapper mapper;

    public DocumentNotificationStore(DocumentStore store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public Notification create(Notification notification) {
        return mapper.convertValue(
                store.create(CollectionNames.NOTIFICATIONS, mapper.valueToTree(notification)), Notification.class);
    }

    @Override
    public List<Notification> listBySubscription(String subscriptionId) {
        return store.list(CollectionNames.NOTIFICATIONS,
                        DocumentQuery.where("subscriptionId", subscriptionId), ListOptions.none()).stream()
                .map(doc -> mapper.convertValue(doc, Notification.class))
                .toList();
    }

    @Override
    public int removeBySubscription(String subscriptionId) {
        return store.remove(CollectionNames.NOTIFICATIONS, DocumentQuery.where("subscriptionId", subscriptionId));
    }
}
