package com.myorg.fanout.contracts.core.conventions;

import java.util.Locale;

/**
 * Document collection names shared by the engine and store implementations.
 *
 * <p>Content collections follow the plural of the action type they hold, so an event with
 * {@code actionType=tick} finds its action in {@code ticks}.
 */
public final class CollectionNames {
    private CollectionNames() {}

    public static final String SUBSCRIPTIONS = "subscriptions";
    public static final String EVENTS = "events";
    public static final String NOTIFICATIONS = "notifications";

    public static final String MEMBERS = "members";
    public static final String POSTS = "posts";
    public static final String SESSIONS = "sessions";
    public static final String ACTIONS = "actions";
    public static final String TICKS = "ticks";
    public static final String CRAGS = "crags";
    public static final String ASCENTS = "ascents";
    public static final String HANGTENS = "hangtens";
    public static final String COMMENTS = "comments";
    public static final String MEDIAS = "medias";

    public static final String DATASETS = "datasets";
    public static final String VIEWS = "views";
    public static final String NOTES = "notes";

    public static String forType(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        return type.trim().toLowerCase(Locale.ROOT) + "s";
    }
}
