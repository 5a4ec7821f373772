package com.hookvisor.core.rpc;

/**
 * 钩子调用出口
 * <p>
 * 由监督器实现：负责选择当前进程的通道、处理崩溃与重启。代理本身只做转发。
 */
@FunctionalInterface
public interface HookInvoker {

    Object invokeHook(HookMethod method, Object... args);
}
