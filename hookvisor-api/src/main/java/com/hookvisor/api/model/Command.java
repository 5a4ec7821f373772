package com.hookvisor.api.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 插件注册的斜杠命令
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Command {
    private String teamId;
    private String trigger;
    private String displayName;
    private String description;
    private boolean autoComplete;
    private String autoCompleteHint;
}
