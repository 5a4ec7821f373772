package com.hookvisor.core.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;

/**
 * 帧编解码
 * <p>
 * 格式：4 字节大端长度前缀 + UTF-8 JSON。
 */
public class FrameCodec {

    public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;

    private final ObjectMapper mapper;
    private final int maxFrameBytes;

    public FrameCodec() {
        this(DEFAULT_MAX_FRAME_BYTES);
    }

    public FrameCodec(int maxFrameBytes) {
        this.maxFrameBytes = maxFrameBytes;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    /**
     * 调用方负责同步，同一输出流上不能并发写
     *
     * @throws FrameEncodingException 帧无法编码或超过上限，此时流上没有写出任何字节
     * @throws IOException            写出过程中的 I/O 错误
     */
    public void write(DataOutputStream out, Frame frame) throws IOException {
        writePayload(out, encode(frame));
    }

    /**
     * 写出已由 {@link #encode(Frame)} 编码的帧
     */
    public void writePayload(DataOutputStream out, byte[] payload) throws IOException {
        out.writeInt(payload.length);
        out.write(payload);
        out.flush();
    }

    public byte[] encode(Frame frame) {
        byte[] payload;
        try {
            payload = mapper.writeValueAsBytes(frame);
        } catch (JsonProcessingException e) {
            throw new FrameEncodingException("frame", "Failed to encode frame " + frame.getId(), e);
        }
        if (payload.length > maxFrameBytes) {
            throw new FrameEncodingException("frame",
                    "Frame too large: " + payload.length + " bytes (limit " + maxFrameBytes + ")");
        }
        return payload;
    }

    /**
     * @return 流在帧边界处结束时返回 null
     */
    public Frame read(DataInputStream in) throws IOException {
        int length;
        try {
            length = in.readInt();
        } catch (EOFException e) {
            return null;
        }
        if (length < 0 || length > maxFrameBytes) {
            throw new ProtocolException("Invalid frame length: " + length);
        }
        byte[] payload = new byte[length];
        in.readFully(payload);
        try {
            Frame frame = mapper.readValue(payload, Frame.class);
            if (frame.getKind() == null) {
                throw new ProtocolException("Frame without kind, id=" + frame.getId());
            }
            return frame;
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed frame", e);
        }
    }

    /**
     * @throws FrameEncodingException 值无法转换为 JSON
     */
    public JsonNode toTree(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        try {
            return mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new FrameEncodingException("value",
                    "Cannot encode " + value.getClass().getName() + ": " + e.getMessage(), e);
        }
    }

    public <T> T fromTree(JsonNode node, Class<T> type) {
        if (node == null || node.isNull() || type == Void.class || type == void.class) {
            return null;
        }
        return mapper.convertValue(node, type);
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }
}
