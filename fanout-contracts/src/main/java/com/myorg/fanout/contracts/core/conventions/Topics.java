package com.myorg.fanout.contracts.core.conventions;

public final class Topics {
    private Topics() {}

    public static final String EVENT_NEW = "event.new";
    public static final String NOTIFICATION_NEW = "notification.new";
    public static final String NOTIFICATION_REMOVED = "notification.removed";

    // dùng: <channel>.new / <channel>.removed, ví dụ follow.new, watch.removed
    public static String created(String channel) {
        return channel + ".new";
    }

    public static String removed(String channel) {
        return channel + ".removed";
    }
}
