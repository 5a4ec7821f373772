package com.hookvisor.core.enums;

public enum SupervisorState {
    CREATED, // 已创建，路径已校验，无进程
    STARTING, // 首次启动中（进程已创建，握手进行中）
    RUNNING, // 运行中
    CRASHED, // 进程意外退出或通道断开，等待重启
    RESTARTING, // 重启中
    STOPPED // 已停止（终态）
}
