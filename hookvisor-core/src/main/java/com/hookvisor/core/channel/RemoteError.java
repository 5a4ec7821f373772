package com.hookvisor.core.channel;

import com.hookvisor.api.exception.HookInvocationException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RemoteError {

    private String type;
    private String message;

    public static RemoteError of(Throwable e) {
        // 嵌套调用的错误保持最初的异常类型
        String type = e instanceof HookInvocationException
                ? ((HookInvocationException) e).getRemoteType()
                : e.getClass().getName();
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new RemoteError(type, message);
    }
}
