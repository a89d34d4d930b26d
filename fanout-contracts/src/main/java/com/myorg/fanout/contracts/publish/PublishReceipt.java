package com.myorg.fanout.contracts.publish;

/**
 * Outcome of a publish call.
 *
 * @param eventId       id of the created or amended event, null for raw-only publishes
 * @param recipients    resolved subscriptions after access filtering
 * @param notifications persisted notifications
 * @param rejected      true when hydration vetoed the event and nothing was delivered
 */
public record PublishReceipt(String eventId, int recipients, int notifications, boolean rejected) {

    public static PublishReceipt rawOnly() {
        return new PublishReceipt(null, 0, 0, false);
    }

    public static PublishReceipt rejected(String eventId, int recipients) {
        return new PublishReceipt(eventId, recipients, 0, true);
    }

    public static PublishReceipt delivered(String eventId, int recipients, int notifications) {
        return new PublishReceipt(eventId, recipients, notifications, false);
    }

    public String outcome() {
        if (rejected) return "rejected";
        return eventId == null ? "raw" : "delivered";
    }
}
