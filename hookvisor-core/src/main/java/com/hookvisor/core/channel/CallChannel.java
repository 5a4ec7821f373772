package com.hookvisor.core.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.hookvisor.api.exception.HookInvocationException;
import com.hookvisor.core.exception.CallInterruptedException;
import com.hookvisor.core.exception.ChannelBrokenException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 双向调用通道
 * <p>
 * 一对字节流上的多路复用请求/响应传输：
 * <ul>
 *     <li>出站调用按 id 关联响应，并发调用互不干扰，完成顺序不限</li>
 *     <li>入站调用交给 {@link CallHandler}，在工作线程上执行，因此一端在等待响应时仍可处理对端的回调</li>
 *     <li>传输中断（EOF、I/O 错误、帧格式错误、主动关闭）统一表现为 {@link ChannelBrokenException}，
 *     所有挂起的调用立即失败</li>
 * </ul>
 */
@Slf4j
public class CallChannel implements AutoCloseable {

    private final String name;
    private final DataInputStream in;
    private final DataOutputStream out;
    private final FrameCodec codec;
    private final CallHandler handler;
    private final ExecutorService workers;

    private final Map<Long, CompletableFuture<Frame>> pending = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong();
    private final Object writeLock = new Object();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final List<Consumer<Throwable>> closeListeners = new CopyOnWriteArrayList<>();

    private volatile Throwable closeCause;

    public CallChannel(String name, InputStream in, OutputStream out, FrameCodec codec, CallHandler handler) {
        this.name = name;
        this.in = new DataInputStream(new BufferedInputStream(in));
        this.out = new DataOutputStream(new BufferedOutputStream(out));
        this.codec = codec;
        this.handler = handler;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "hookvisor-call-" + name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 启动读线程
     */
    public CallChannel start() {
        if (started.compareAndSet(false, true)) {
            Thread reader = new Thread(this::readLoop, "hookvisor-channel-" + name);
            reader.setDaemon(true);
            reader.start();
        }
        return this;
    }

    // ==================== 出站调用 ====================

    /**
     * 同步调用，直到收到响应或通道断开
     *
     * @throws HookInvocationException 对端返回错误
     * @throws FrameEncodingException  参数无法编码或超过帧上限，通道保持可用
     * @throws ChannelBrokenException  通道断开
     */
    public <T> T invoke(String method, Class<T> resultType, Object... args) {
        try {
            return doInvoke(method, resultType, null, args);
        } catch (TimeoutException e) {
            // 无超时调用不会走到这里
            throw new IllegalStateException(e);
        }
    }

    /**
     * 带超时的同步调用，超时后放弃等待（对端可能仍在执行）
     */
    public <T> T invokeWithin(Duration timeout, String method, Class<T> resultType, Object... args)
            throws TimeoutException {
        return doInvoke(method, resultType, timeout, args);
    }

    private <T> T doInvoke(String method, Class<T> resultType, Duration timeout, Object[] args)
            throws TimeoutException {
        ensureOpen(method);

        // 参数先编码，编码失败属于调用方错误，不登记挂起调用也不影响通道
        List<JsonNode> encoded = new ArrayList<>(args != null ? args.length : 0);
        if (args != null) {
            for (Object arg : args) {
                encoded.add(codec.toTree(arg));
            }
        }

        long id = nextId.incrementAndGet();
        Frame call = Frame.call(id, method, encoded);
        byte[] payload = codec.encode(call);

        CompletableFuture<Frame> future = new CompletableFuture<>();
        pending.put(id, future);

        // 注册后再次检查，避免与 breakChannel 的竞争导致永久挂起
        if (closed.get()) {
            pending.remove(id);
            throw broken(method, closeCause);
        }

        try {
            send(payload);
        } catch (IOException e) {
            pending.remove(id);
            breakChannel(e);
            throw broken(method, e);
        }

        Frame reply = await(method, id, future, timeout);
        if (reply.getError() != null) {
            throw new HookInvocationException(method, reply.getError().getType(), reply.getError().getMessage());
        }
        return codec.fromTree(reply.getResult(), resultType);
    }

    private Frame await(String method, long id, CompletableFuture<Frame> future, Duration timeout)
            throws TimeoutException {
        try {
            if (timeout == null) {
                return future.get();
            }
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            pending.remove(id);
            Thread.currentThread().interrupt();
            throw new CallInterruptedException(method, e);
        } catch (TimeoutException e) {
            pending.remove(id);
            throw e;
        } catch (ExecutionException e) {
            throw broken(method, e.getCause());
        }
    }

    // ==================== 读循环 ====================

    private void readLoop() {
        try {
            while (!closed.get()) {
                Frame frame = codec.read(in);
                if (frame == null) {
                    breakChannel(new EOFException("Peer closed the stream"));
                    return;
                }
                if (frame.getKind() == Frame.Kind.REPLY) {
                    completeCall(frame);
                } else {
                    dispatchCall(frame);
                }
            }
        } catch (IOException | RuntimeException e) {
            breakChannel(e);
        }
    }

    private void completeCall(Frame reply) {
        CompletableFuture<Frame> future = pending.remove(reply.getId());
        if (future == null) {
            // 超时后迟到的响应
            log.debug("[{}] Dropping reply for unknown call id {}", name, reply.getId());
            return;
        }
        future.complete(reply);
    }

    private void dispatchCall(Frame call) {
        try {
            workers.execute(() -> handleCall(call));
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Channel closing, dropped inbound call {}", name, call.getMethod());
        }
    }

    private void handleCall(Frame call) {
        byte[] payload;
        try {
            Object result = handler.handle(call.getMethod(), new CallArguments(call.getArgs(), codec));
            payload = codec.encode(Frame.reply(call.getId(), codec.toTree(result)));
        } catch (Exception e) {
            log.debug("[{}] Inbound call {} failed: {}", name, call.getMethod(), e.getMessage());
            payload = encodeFailure(call, e);
        }
        if (payload == null) {
            return;
        }
        try {
            send(payload);
        } catch (IOException e) {
            log.debug("[{}] Could not deliver reply for {}: {}", name, call.getMethod(), e.getMessage());
            breakChannel(e);
        }
    }

    private byte[] encodeFailure(Frame call, Exception e) {
        try {
            return codec.encode(Frame.failure(call.getId(), RemoteError.of(e)));
        } catch (FrameEncodingException tooLarge) {
            // 错误消息本身超限时只回传类型
            try {
                return codec.encode(Frame.failure(call.getId(), new RemoteError(e.getClass().getName(),
                        "error message exceeds frame limit")));
            } catch (FrameEncodingException stillTooLarge) {
                log.warn("[{}] Cannot encode failure reply for {}, frame limit {} too small",
                        name, call.getMethod(), codec.getMaxFrameBytes());
                breakChannel(new ProtocolException("Cannot deliver reply for " + call.getMethod(), stillTooLarge));
                return null;
            }
        }
    }

    private void send(byte[] payload) throws IOException {
        synchronized (writeLock) {
            if (closed.get()) {
                throw new IOException("Channel closed");
            }
            codec.writePayload(out, payload);
        }
    }

    // ==================== 关闭 ====================

    /**
     * 注册断开监听，通道断开或关闭时回调一次；已断开则立即回调
     */
    public void onClose(Consumer<Throwable> listener) {
        closeListeners.add(listener);
        if (closed.get() && closeListeners.remove(listener)) {
            listener.accept(closeCause);
        }
    }

    /**
     * 主动关闭：关闭输出流（对端读到 EOF），挂起的调用以 ChannelBrokenException 失败
     */
    @Override
    public void close() {
        breakChannel(new IOException("Channel closed by local side"));
    }

    private void breakChannel(Throwable cause) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        closeCause = cause;
        if (cause instanceof EOFException) {
            log.debug("[{}] Channel reached end of stream", name);
        } else {
            log.debug("[{}] Channel closed: {}", name, cause.toString());
        }

        synchronized (writeLock) {
            closeQuietly(out, "output");
        }
        closeQuietly(in, "input");

        for (Map.Entry<Long, CompletableFuture<Frame>> entry : pending.entrySet()) {
            if (pending.remove(entry.getKey(), entry.getValue())) {
                entry.getValue().completeExceptionally(cause);
            }
        }
        workers.shutdown();

        for (Consumer<Throwable> listener : closeListeners) {
            if (closeListeners.remove(listener)) {
                try {
                    listener.accept(cause);
                } catch (RuntimeException e) {
                    log.warn("[{}] Close listener failed", name, e);
                }
            }
        }
    }

    private void closeQuietly(AutoCloseable stream, String what) {
        try {
            stream.close();
        } catch (Exception e) {
            log.debug("[{}] Failed to close {} stream: {}", name, what, e.getMessage());
        }
    }

    private void ensureOpen(String method) {
        if (closed.get()) {
            throw broken(method, closeCause);
        }
    }

    private ChannelBrokenException broken(String method, Throwable cause) {
        String reason = cause instanceof EOFException
                ? "peer exited while calling " + method
                : "transport lost while calling " + method;
        return new ChannelBrokenException(name, reason, cause);
    }

    public boolean isOpen() {
        return !closed.get();
    }

    public String getName() {
        return name;
    }

    public int getPendingCount() {
        return pending.size();
    }
}
