package com.hookvisor.api.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HttpResponseData {
    private int status;
    @Builder.Default
    private Map<String, String> headers = new HashMap<>();
    private byte[] body;

    /**
     * 插件未实现 HTTP 钩子时的响应
     */
    public static HttpResponseData notFound() {
        return HttpResponseData.builder()
                .status(404)
                .body("Not found.".getBytes(StandardCharsets.UTF_8))
                .build();
    }
}
