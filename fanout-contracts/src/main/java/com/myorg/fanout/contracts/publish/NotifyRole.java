package com.myorg.fanout.contracts.publish;

// Which side of a resolved subscription receives the persisted notification.
public enum NotifyRole {
    SUBSCRIBER,
    SUBSCRIBEE
}
