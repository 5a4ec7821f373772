package com.hookvisor.api.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommandResponse {

    public static final String EPHEMERAL = "ephemeral";
    public static final String IN_CHANNEL = "in_channel";

    private String responseType;
    private String text;

    public static CommandResponse ephemeral(String text) {
        return new CommandResponse(EPHEMERAL, text);
    }
}
