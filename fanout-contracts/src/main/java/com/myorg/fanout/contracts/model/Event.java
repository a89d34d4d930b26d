package com.myorg.fanout.contracts.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.*;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Event {
    private String id;
    private String actorId;
    private String targetId;        // optional
    private String targetAuthorId;  // optional
    private String actionId;
    private String actionType;      // hydration variant tag: post, tick, follow, dataset...
    private Long date;              // epoch millis, taken from data.date / data.created when absent

    @Builder.Default
    @JsonProperty("public")
    private boolean publicEvent = true;

    private ObjectNode data;        // {action:{...}, target:{...}} snapshot
}
