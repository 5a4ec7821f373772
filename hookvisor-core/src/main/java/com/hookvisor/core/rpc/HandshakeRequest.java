package com.hookvisor.core.rpc;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HandshakeRequest {
    private int protocolVersion;
    private String pluginId;
}
