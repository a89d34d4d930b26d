package com.myorg.fanout.engine.store;

/**
 * Sort, then limit, then optionally reverse the limited page.
 *
 * <p>{@code sortBy("created", -1).limit(5).reversed()} yields the newest five items in
 * chronological order.
 *
 * @param sortField null for store order
 * @param direction 1 ascending, -1 descending
 * @param limit     null for no limit
 */
public record ListOptions(String sortField, int direction, Integer limit, boolean reverse) {

    public static ListOptions none() {
        return new ListOptions(null, 1, null, false);
    }

    public static ListOptions sortBy(String field, int direction) {
        return new ListOptions(field, direction < 0 ? -1 : 1, null, false);
    }

    public ListOptions limit(int max) {
        return new ListOptions(sortField, direction, max, reverse);
    }

    public ListOptions reversed() {
        return new ListOptions(sortField, direction, limit, true);
    }
}
