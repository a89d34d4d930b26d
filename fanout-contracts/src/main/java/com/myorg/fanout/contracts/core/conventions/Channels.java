package com.myorg.fanout.contracts.core.conventions;

public final class Channels {
    private Channels() {}

    // every member listens on "<prefix><memberId>"
    public static final String DEFAULT_PRIVATE_PREFIX = "mem-";

    public static String privateChannel(String prefix, String memberId) {
        if (memberId == null || memberId.isBlank()) {
            throw new IllegalArgumentException("memberId must not be blank");
        }
        String p = prefix == null ? DEFAULT_PRIVATE_PREFIX : prefix;
        return p + memberId;
    }
}
