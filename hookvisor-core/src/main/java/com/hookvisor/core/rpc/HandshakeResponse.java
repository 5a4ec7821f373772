package com.hookvisor.core.rpc;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HandshakeResponse {
    private int protocolVersion;
    /**
     * 插件实现类覆盖了的钩子（远程方法名）
     */
    private List<String> implementedHooks = new ArrayList<>();
}
