package com.myorg.fanout.engine.resolve;

import com.myorg.fanout.contracts.model.Member;
import com.myorg.fanout.contracts.model.Subscription;
import com.myorg.fanout.contracts.publish.NotifyRole;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A resolved subscription enriched with the profiles of both parties. Never persisted.
 */
@Getter
@Setter
@ToString
public class Recipient {
    private final Subscription subscription;
    private volatile Member subscriber;
    private volatile Member subscribee;
    private volatile boolean rejected;

    public Recipient(Subscription subscription) {
        this.subscription = subscription;
    }

    public Member member(NotifyRole role) {
        return role == NotifyRole.SUBSCRIBER ? subscriber : subscribee;
    }
}
