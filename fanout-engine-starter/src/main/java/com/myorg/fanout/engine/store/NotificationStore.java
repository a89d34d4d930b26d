package com.myorg.fanout.engine.store;

import com.myorg.fanout.contracts.model.Notification;

import java.util.List;

public interface NotificationStore {

    Notification create(Notification notification);

    List<Notification> listBySubscription(String subscriptionId);

    int removeBySubscription(String subscriptionId);
}
