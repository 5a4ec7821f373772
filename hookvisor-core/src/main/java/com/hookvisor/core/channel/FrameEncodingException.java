package com.hookvisor.core.channel;

import com.hookvisor.api.exception.InvalidArgumentException;

/**
 * 出站数据无法编码成帧（无法序列化或超过帧大小上限）
 * <p>
 * 在写出任何字节之前抛出，通道保持可用。
 */
public class FrameEncodingException extends InvalidArgumentException {

    public FrameEncodingException(String paramName, String message) {
        super(paramName, message);
    }

    public FrameEncodingException(String paramName, String message, Throwable cause) {
        super(paramName, message);
        initCause(cause);
    }
}
