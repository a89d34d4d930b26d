package com.myorg.fanout.engine.join;

import com.myorg.fanout.contracts.core.conventions.CollectionNames;

import java.util.Locale;

public final class Profiles {
    private Profiles() {}

    public static final Profile MEMBER = Profile.of(CollectionNames.MEMBERS,
            "displayName", "username", "gravatar");

    // routing needs the address and per-channel preferences
    public static final Profile MEMBER_CONTACT = MEMBER.with("primaryEmail", "config");

    public static final Profile CRAG = Profile.of(CollectionNames.CRAGS,
            "name", "country", "city", "authorId", "public");

    public static final Profile ASCENT = Profile.of(CollectionNames.ASCENTS,
            "name", "grade", "type", "cragId", "authorId", "public");

    public static final Profile DATASET = Profile.of(CollectionNames.DATASETS,
            "title", "description", "authorId", "public");

    public static final Profile VIEW = Profile.of(CollectionNames.VIEWS,
            "title", "datasetId", "authorId", "public");

    /**
     * Summary profile for a subscribable or parent type; unknown types get the whole document.
     */
    public static Profile forType(String type) {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "member" -> MEMBER;
            case "crag" -> CRAG;
            case "ascent" -> ASCENT;
            case "dataset" -> DATASET;
            case "view" -> VIEW;
            default -> Profile.all(CollectionNames.forType(type));
        };
    }
}
