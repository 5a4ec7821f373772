package com.hookvisor.core.channel;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.List;

/**
 * 入站调用的参数列表，按需解码
 */
public class CallArguments {

    private final List<JsonNode> nodes;
    private final FrameCodec codec;

    public CallArguments(List<JsonNode> nodes, FrameCodec codec) {
        this.nodes = nodes != null ? nodes : Collections.emptyList();
        this.codec = codec;
    }

    /**
     * @return 参数缺失或为 null 时返回 null
     */
    public <T> T get(int index, Class<T> type) {
        if (index >= nodes.size()) {
            return null;
        }
        return codec.fromTree(nodes.get(index), type);
    }

    public int size() {
        return nodes.size();
    }
}
