package com.hookvisor.core.channel;

import java.io.IOException;

/**
 * 帧格式错误
 * 与 I/O 错误同等对待：通道立即断开。
 */
public class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
