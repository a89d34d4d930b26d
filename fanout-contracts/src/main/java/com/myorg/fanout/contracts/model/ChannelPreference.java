package com.myorg.fanout.contracts.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChannelPreference {
    // member settings store either a boolean or the string "true"
    private JsonNode email;

    public boolean isEmailEnabled() {
        if (email == null) return false;
        return email.isBoolean() ? email.booleanValue() : email.isTextual() && "true".equals(email.textValue());
    }
}
