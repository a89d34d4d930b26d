package com.myorg.fanout.engine.store;

import com.myorg.fanout.contracts.core.exception.DuplicateSubscriptionException;
import com.myorg.fanout.contracts.model.Subscription;
import com.myorg.fanout.contracts.model.SubscriptionStyle;

import java.util.List;
import java.util.Optional;

public interface SubscriptionStore {

    /**
     * @throws DuplicateSubscriptionException when the (subscriber, subscribee) pair already exists
     */
    Subscription create(Subscription subscription);

    Optional<Subscription> findByPair(String subscriberId, String subscribeeId);

    List<Subscription> list(DocumentQuery query);

    /**
     * Moves a subscription from {@code expected} to {@code next} style.
     *
     * @return number of records updated, 0 when the id is unknown or the style moved on
     */
    int updateStyle(String id, SubscriptionStyle expected, SubscriptionStyle next);

    int remove(String id);
}
