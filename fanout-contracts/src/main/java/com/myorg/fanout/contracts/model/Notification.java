package com.myorg.fanout.contracts.model;

import lombok.*;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Notification {
    private String id;
    private String subscriberId;   // recipient
    private String subscriptionId;
    private String eventId;
    private boolean read;
}
