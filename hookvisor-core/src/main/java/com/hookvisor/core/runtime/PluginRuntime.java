package com.hookvisor.core.runtime;

import com.hookvisor.api.model.CommandArgs;
import com.hookvisor.api.model.HttpRequestData;
import com.hookvisor.api.plugin.PluginHooks;
import com.hookvisor.core.channel.CallArguments;
import com.hookvisor.core.channel.CallChannel;
import com.hookvisor.core.channel.CallHandler;
import com.hookvisor.core.channel.FrameCodec;
import com.hookvisor.core.rpc.HandshakeRequest;
import com.hookvisor.core.rpc.HandshakeResponse;
import com.hookvisor.core.rpc.HookMethod;
import com.hookvisor.core.rpc.Protocol;
import com.hookvisor.core.rpc.RemotePluginApi;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * 插件进程侧运行时
 * <p>
 * 插件后端的 main 方法调用 {@link #serve(PluginHooks)}：标准输入/输出作为调用通道，
 * 处理握手、激活（注入宿主能力代理）、各钩子调用以及停机信号。
 * 宿主关闭标准输入后返回。
 */
@Slf4j
public class PluginRuntime implements CallHandler {

    private final PluginHooks hooks;
    private final CallChannel channel;
    private final CountDownLatch closed = new CountDownLatch(1);

    private volatile String pluginId = "plugin";
    private volatile boolean shutdownRequested;

    public PluginRuntime(PluginHooks hooks, InputStream in, OutputStream out) {
        this(hooks, in, out, new FrameCodec());
    }

    public PluginRuntime(PluginHooks hooks, InputStream in, OutputStream out, FrameCodec codec) {
        this.hooks = hooks;
        this.channel = new CallChannel("plugin-side", in, out, codec, this);
        this.channel.onClose(cause -> closed.countDown());
    }

    /**
     * 插件后端入口，通道关闭后结束 JVM
     */
    public static void serve(PluginHooks hooks) {
        // 标准输出归协议独占，其余输出（包括日志）改写到标准错误
        PrintStream protocolOut = System.out;
        System.setOut(System.err);

        new PluginRuntime(hooks, System.in, protocolOut).run();
        System.exit(0);
    }

    /**
     * 阻塞直到宿主关闭通道
     */
    public void run() {
        channel.start();
        try {
            closed.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.close();
        }
        log.info("[{}] Plugin runtime finished (shutdownRequested={})", pluginId, shutdownRequested);
    }

    @Override
    public Object handle(String method, CallArguments args) {
        HookMethod hook = HookMethod.fromWireName(method)
                .orElseThrow(() -> new UnsupportedOperationException("Unknown plugin method: " + method));

        switch (hook) {
            case HANDSHAKE:
                return handshake(args.get(0, HandshakeRequest.class));
            case ON_ACTIVATE:
                hooks.onActivate(new RemotePluginApi(channel));
                return null;
            case ON_DEACTIVATE:
                hooks.onDeactivate();
                return null;
            case ON_CONFIGURATION_CHANGE:
                hooks.onConfigurationChange();
                return null;
            case EXECUTE_COMMAND:
                return hooks.executeCommand(args.get(0, CommandArgs.class));
            case SERVE_HTTP:
                return hooks.serveHttp(args.get(0, HttpRequestData.class));
            case SHUTDOWN:
                // 宿主随后关闭标准输入，run() 因此返回
                shutdownRequested = true;
                log.info("[{}] Shutdown requested by host", pluginId);
                return null;
            default:
                throw new UnsupportedOperationException("Unhandled plugin method: " + method);
        }
    }

    private HandshakeResponse handshake(HandshakeRequest request) {
        if (request == null || request.getProtocolVersion() != Protocol.VERSION) {
            throw new IllegalArgumentException("Unsupported protocol version: "
                    + (request != null ? request.getProtocolVersion() : null)
                    + ", expected " + Protocol.VERSION);
        }
        if (request.getPluginId() != null) {
            pluginId = request.getPluginId();
        }

        List<String> implemented = new ArrayList<>();
        for (HookMethod method : HookMethod.values()) {
            if (method.isOverriddenBy(hooks)) {
                implemented.add(method.wireName());
            }
        }
        log.info("[{}] Handshake complete, implemented hooks: {}", pluginId, implemented);
        return new HandshakeResponse(Protocol.VERSION, implemented);
    }

    public boolean isShutdownRequested() {
        return shutdownRequested;
    }
}
