package com.hookvisor.api.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * 转发给插件的 HTTP 请求快照
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HttpRequestData {
    private String method;
    private String path;
    private String query;
    @Builder.Default
    private Map<String, String> headers = new HashMap<>();
    private byte[] body;
}
