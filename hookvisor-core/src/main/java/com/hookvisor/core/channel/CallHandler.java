package com.hookvisor.core.channel;

/**
 * 入站调用处理器
 * <p>
 * 返回值作为 REPLY 结果发回；抛出的异常转换为错误 REPLY，不会影响通道。
 */
@FunctionalInterface
public interface CallHandler {

    Object handle(String method, CallArguments args) throws Exception;
}
