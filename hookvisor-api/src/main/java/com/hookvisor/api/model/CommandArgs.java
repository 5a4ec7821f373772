package com.hookvisor.api.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommandArgs {
    private String userId;
    private String teamId;
    private String channelId;
    /**
     * 完整的命令文本，例如 "/weather berlin"
     */
    private String command;
}
