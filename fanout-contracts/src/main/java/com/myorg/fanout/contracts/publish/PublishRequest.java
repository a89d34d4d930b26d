package com.myorg.fanout.contracts.publish;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.contracts.model.Event;
import lombok.*;

import java.util.EnumSet;
import java.util.Set;

/**
 * Parameters of one publish call.
 *
 * <ul>
 *   <li>{@code data}: raw payload pushed on the publish channel (required).</li>
 *   <li>{@code event}: when present an Event record is created, or amended when it carries an id.</li>
 *   <li>{@code eventPatch}: fields to set on an existing event (dotted paths allowed).</li>
 *   <li>{@code options}: recipient resolution method.</li>
 *   <li>{@code notify}: roles of each resolved subscription that receive a Notification.</li>
 * </ul>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PublishRequest {
    private ObjectNode data;
    private Event event;
    private ObjectNode eventPatch;
    private PublishOptions options;

    @Builder.Default
    private Set<NotifyRole> notify = EnumSet.noneOf(NotifyRole.class);

    public static PublishRequest of(ObjectNode data) {
        return PublishRequest.builder().data(data).build();
    }

    public boolean hasEvent() {
        return event != null;
    }

    public boolean notifies(NotifyRole role) {
        return notify != null && notify.contains(role);
    }

    /**
     * Deep copy, so callers may keep mutating their own nodes after the call returns.
     */
    public PublishRequest copy() {
        return PublishRequest.builder()
                .data(data == null ? null : data.deepCopy())
                .event(event == null ? null : event.toBuilder()
                        .data(event.getData() == null ? null : event.getData().deepCopy())
                        .build())
                .eventPatch(eventPatch == null ? null : eventPatch.deepCopy())
                .options(options == null ? null : options.toBuilder().build())
                .notify(notify == null || notify.isEmpty()
                        ? EnumSet.noneOf(NotifyRole.class)
                        : EnumSet.copyOf(notify))
                .build();
    }
}
