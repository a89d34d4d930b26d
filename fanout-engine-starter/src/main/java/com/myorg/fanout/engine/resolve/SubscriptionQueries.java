package com.myorg.fanout.engine.resolve;

import com.myorg.fanout.contracts.model.SubscriptionStyle;
import com.myorg.fanout.engine.store.DocumentQuery;

final class SubscriptionQueries {
    private SubscriptionQueries() {}

    static DocumentQuery active(String subscribeeId, SubscriptionStyle style) {
        return DocumentQuery.where("subscribeeId", subscribeeId)
                .and("meta.style", style.wireName())
                .and("mute", false);
    }

    static boolean present(String id) {
        return id != null && !id.isBlank();
    }
}
