package com.hookvisor.core.supervisor;

import com.hookvisor.api.config.BundleDescriptor;
import com.hookvisor.api.event.PluginEvent;
import com.hookvisor.api.event.lifecycle.PluginCrashedEvent;
import com.hookvisor.api.event.lifecycle.PluginRelaunchedEvent;
import com.hookvisor.api.event.lifecycle.PluginStartedEvent;
import com.hookvisor.api.event.lifecycle.PluginStoppedEvent;
import com.hookvisor.api.exception.HookInvocationException;
import com.hookvisor.api.exception.InvalidArgumentException;
import com.hookvisor.api.model.CommandArgs;
import com.hookvisor.api.model.CommandResponse;
import com.hookvisor.api.model.HttpRequestData;
import com.hookvisor.api.model.HttpResponseData;
import com.hookvisor.api.plugin.PluginApi;
import com.hookvisor.api.plugin.PluginHooks;
import com.hookvisor.core.enums.SupervisorState;
import com.hookvisor.core.event.EventBus;
import com.hookvisor.core.exception.ChannelBrokenException;
import com.hookvisor.core.exception.ExecutableLaunchFailedException;
import com.hookvisor.core.exception.InvalidExecutablePathException;
import com.hookvisor.core.exception.PluginNotRunningException;
import com.hookvisor.core.exception.StartTimeoutException;
import com.hookvisor.core.rpc.HookMethod;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PluginSupervisor 集成测试")
public class PluginSupervisorTest {

    private static final String PLUGIN_ID = "test-plugin";

    @TempDir
    Path root;

    @Mock
    private PluginApi api;

    private EventBus eventBus;
    private List<PluginEvent> events;
    private SupervisorConfig config;
    private PluginSupervisor supervisor;

    @BeforeEach
    void setUp() {
        events = new CopyOnWriteArrayList<>();
        eventBus = new EventBus();
        eventBus.subscribe("test", PluginStartedEvent.class, events::add);
        eventBus.subscribe("test", PluginCrashedEvent.class, events::add);
        eventBus.subscribe("test", PluginRelaunchedEvent.class, events::add);
        eventBus.subscribe("test", PluginStoppedEvent.class, events::add);

        // 子进程是完整 JVM，启动时间给足
        config = SupervisorConfig.builder()
                .startupTimeout(Duration.ofSeconds(20))
                .stopGracePeriod(Duration.ofSeconds(2))
                .build();

        when(api.getPluginConfiguration()).thenReturn(Map.of("greeting", "hello"));
    }

    @AfterEach
    void tearDown() {
        if (supervisor != null) {
            supervisor.stop();
        }
    }

    // ==================== 辅助方法 ====================

    private PluginSupervisor supervisorFor(SupervisorConfig supervisorConfig) {
        supervisor = new PluginSupervisor(BundleDescriptor.of(PLUGIN_ID, root, BackendScripts.EXECUTABLE),
                supervisorConfig, eventBus);
        return supervisor;
    }

    private PluginSupervisor startJavaBackend(String mode) throws Exception {
        BackendScripts.javaBackend(root, mode);
        PluginSupervisor started = supervisorFor(config);
        started.start(api);
        return started;
    }

    private static CommandArgs command(String text) {
        return CommandArgs.builder().userId("u1").teamId("t1").channelId("c1").command(text).build();
    }

    // ==================== 路径校验 ====================

    @Nested
    @DisplayName("可执行文件路径")
    class PathValidationTests {

        @Test
        @DisplayName("逃逸出根目录的路径应在创建时被拒绝")
        void escapingPathShouldBeRejected() {
            BundleDescriptor bundle = BundleDescriptor.of(PLUGIN_ID, root, "/foo/../../backend.exe");

            assertThrows(InvalidExecutablePathException.class,
                    () -> new PluginSupervisor(bundle, config, eventBus));
        }

        @Test
        @DisplayName("以分隔符开头的路径拼接在根目录之下")
        void leadingSeparatorShouldStayUnderRoot() throws Exception {
            BackendScripts.javaBackend(root, "noop");

            PluginSupervisor created = new PluginSupervisor(
                    BundleDescriptor.of(PLUGIN_ID, root, "/" + BackendScripts.EXECUTABLE), config, eventBus);

            assertEquals(root.toAbsolutePath().normalize().resolve(BackendScripts.EXECUTABLE), created.getExecutable());
            assertEquals(SupervisorState.CREATED, created.getState());
        }
    }

    // ==================== 启动 ====================

    @Nested
    @DisplayName("启动")
    class StartTests {

        @Test
        @DisplayName("启动成功后处于运行状态并发布事件")
        void startShouldReachRunning() throws Exception {
            PluginSupervisor started = startJavaBackend("echo");

            assertEquals(SupervisorState.RUNNING, started.getState());
            assertEquals(1, started.getGeneration());
            assertTrue(started.getPid().isPresent());
            assertTrue(events.stream().anyMatch(e -> e instanceof PluginStartedEvent));
        }

        @Test
        @DisplayName("工作目录为插件根目录")
        void workingDirectoryShouldBeBundleRoot() throws Exception {
            PluginSupervisor started = startJavaBackend("echo");

            CommandResponse response = started.hooks().executeCommand(command("/cwd"));

            assertEquals(root.toRealPath(), Paths.get(response.getText()).toRealPath());
        }

        @Test
        @DisplayName("可执行文件不存在应启动失败")
        void missingExecutableShouldFail() {
            PluginSupervisor created = supervisorFor(config);

            assertThrows(ExecutableLaunchFailedException.class, () -> created.start(api));
            assertEquals(SupervisorState.CREATED, created.getState());
        }

        @Test
        @DisplayName("没有执行权限应启动失败")
        void nonExecutableFileShouldFail() throws Exception {
            Path script = root.resolve(BackendScripts.EXECUTABLE);
            Files.createDirectories(script.getParent());
            Files.write(script, "#!/bin/sh\nexit 0\n".getBytes());
            PluginSupervisor created = supervisorFor(config);

            assertThrows(ExecutableLaunchFailedException.class, () -> created.start(api));
        }

        @Test
        @DisplayName("握手前退出应启动失败")
        void earlyExitShouldFail() throws Exception {
            BackendScripts.shell(root, "exit 3");
            PluginSupervisor created = supervisorFor(config);

            ExecutableLaunchFailedException e =
                    assertThrows(ExecutableLaunchFailedException.class, () -> created.start(api));
            assertTrue(e.getMessage().contains("exit code 3"), e.getMessage());
        }

        @Test
        @DisplayName("标准输出写入非协议数据应启动失败且进程被杀死")
        void garbageOutputShouldFail() throws Exception {
            BackendScripts.shell(root, "echo $$ > \"" + root.resolve("backend.pid") + "\"\n"
                    + "echo garbage\nexec sleep 600");
            PluginSupervisor created = supervisorFor(config);

            assertThrows(ExecutableLaunchFailedException.class, () -> created.start(api));
            assertFalse(BackendScripts.isAlive(BackendScripts.readPid(root)));
        }

        @Test
        @DisplayName("握手超时应杀死进程")
        void handshakeTimeoutShouldKillProcess() throws Exception {
            BackendScripts.silentBackend(root);
            PluginSupervisor created = supervisorFor(config.toBuilder()
                    .startupTimeout(Duration.ofSeconds(1))
                    .build());

            long begin = System.nanoTime();
            assertThrows(StartTimeoutException.class, () -> created.start(api));
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

            assertTrue(elapsed < 10_000, "start took " + elapsed + "ms");
            assertEquals(SupervisorState.CREATED, created.getState());
            assertFalse(BackendScripts.isAlive(BackendScripts.readPid(root)));
        }

        @Test
        @DisplayName("插件激活失败应以远端错误结束启动")
        void activationFailureShouldPropagate() throws Exception {
            BackendScripts.javaBackend(root, "fail-activate");
            PluginSupervisor created = supervisorFor(config);

            HookInvocationException e = assertThrows(HookInvocationException.class, () -> created.start(api));
            assertEquals("activation refused", e.getMessage());
            assertEquals(IllegalStateException.class.getName(), e.getRemoteType());
            assertEquals(SupervisorState.CREATED, created.getState());
        }

        @Test
        @DisplayName("重复启动应抛出异常")
        void secondStartShouldFail() throws Exception {
            PluginSupervisor started = startJavaBackend("noop");

            assertThrows(IllegalStateException.class, () -> started.start(api));
        }
    }

    // ==================== 钩子调用 ====================

    @Nested
    @DisplayName("钩子调用")
    class HookTests {

        @Test
        @DisplayName("启动前调用钩子应抛出未运行异常")
        void hooksBeforeStartShouldFail() throws Exception {
            BackendScripts.javaBackend(root, "echo");
            PluginSupervisor created = supervisorFor(config);

            assertThrows(PluginNotRunningException.class, () -> created.hooks().onDeactivate());
        }

        @Test
        @DisplayName("命令应转发给插件")
        void commandShouldBeForwarded() throws Exception {
            PluginSupervisor started = startJavaBackend("echo");

            CommandResponse response = started.hooks().executeCommand(command("/echo hi"));

            assertEquals("/echo hi", response.getText());
            assertEquals(CommandResponse.EPHEMERAL, response.getResponseType());
        }

        @Test
        @DisplayName("插件可在钩子调用中回调宿主能力")
        void pluginShouldCallBackIntoHost() throws Exception {
            PluginSupervisor started = startJavaBackend("echo");

            CommandResponse response = started.hooks().executeCommand(command("/config"));

            assertEquals("hello", response.getText());
            verify(api, atLeastOnce()).getPluginConfiguration();
        }

        @Test
        @DisplayName("插件返回错误不影响进程")
        void remoteErrorShouldNotRestart() throws Exception {
            PluginSupervisor started = startJavaBackend("echo");

            HookInvocationException e = assertThrows(HookInvocationException.class,
                    () -> started.hooks().executeCommand(command("/fail")));

            assertEquals("boom", e.getMessage());
            assertEquals(IllegalArgumentException.class.getName(), e.getRemoteType());
            assertEquals(SupervisorState.RUNNING, started.getState());
            assertEquals(1, started.getGeneration());
        }

        @Test
        @DisplayName("超过帧上限的参数在本地被拒绝，插件进程不受影响")
        void oversizedArgumentShouldNotRestart() throws Exception {
            BackendScripts.javaBackend(root, "echo");
            PluginSupervisor started = supervisorFor(config.toBuilder().maxFrameBytes(4096).build());
            started.start(api);
            long pid = started.getPid().getAsLong();

            assertThrows(InvalidArgumentException.class,
                    () -> started.hooks().executeCommand(command("x".repeat(10_000))));

            assertEquals(SupervisorState.RUNNING, started.getState());
            assertEquals(1, started.getGeneration());
            assertEquals(pid, started.getPid().getAsLong());
            assertTrue(ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false));
            assertEquals("/echo ok", started.hooks().executeCommand(command("/echo ok")).getText());
            assertTrue(events.stream().noneMatch(e -> e instanceof PluginCrashedEvent));
        }

        @Test
        @DisplayName("并发调用的结果不会串")
        void concurrentCallsShouldBeCorrelated() throws Exception {
            PluginSupervisor started = startJavaBackend("echo");
            PluginHooks hooks = started.hooks();
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<String>> results = new ArrayList<>();
                for (int i = 0; i < 40; i++) {
                    String text = "/echo " + i;
                    results.add(pool.submit(() -> hooks.executeCommand(command(text)).getText()));
                }
                for (int i = 0; i < results.size(); i++) {
                    assertEquals("/echo " + i, results.get(i).get(30, TimeUnit.SECONDS));
                }
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("未实现的钩子在本地返回默认值")
        void unimplementedHooksShouldAnswerLocally() throws Exception {
            PluginSupervisor started = startJavaBackend("noop");

            assertTrue(started.implementedHooks().isEmpty());
            assertNull(started.hooks().executeCommand(command("/anything")));
            HttpResponseData response = started.hooks().serveHttp(
                    HttpRequestData.builder().method("GET").path("/").build());
            assertEquals(404, response.getStatus());
        }

        @Test
        @DisplayName("握手上报已实现的钩子")
        void implementedHooksShouldBeReported() throws Exception {
            PluginSupervisor started = startJavaBackend("echo");

            assertTrue(started.implementedHooks().contains(HookMethod.EXECUTE_COMMAND.wireName()));
            assertTrue(started.implementedHooks().contains(HookMethod.ON_DEACTIVATE.wireName()));
            assertFalse(started.implementedHooks().contains(HookMethod.SERVE_HTTP.wireName()));
        }

        @Test
        @DisplayName("宿主侧不能直接调用 onActivate")
        void onActivateThroughProxyShouldBeRejected() throws Exception {
            PluginSupervisor started = startJavaBackend("noop");

            assertThrows(UnsupportedOperationException.class, () -> started.hooks().onActivate(api));
        }
    }

    // ==================== 崩溃恢复 ====================

    @Nested
    @DisplayName("崩溃恢复")
    class CrashRecoveryTests {

        @Test
        @DisplayName("调用中崩溃：本次失败，重启后下一次成功")
        void crashDuringCallShouldRelaunch() throws Exception {
            when(api.getPluginConfiguration()).thenReturn(
                    Map.of("shouldExit", true),
                    Map.of("shouldExit", false));
            PluginSupervisor started = startJavaBackend("echo");

            assertThrows(ChannelBrokenException.class, () -> started.hooks().onDeactivate());

            assertEquals(SupervisorState.RUNNING, started.getState());
            assertEquals(2, started.getGeneration());
            assertDoesNotThrow(() -> started.hooks().onDeactivate());

            assertTrue(events.stream().anyMatch(e -> e instanceof PluginCrashedEvent));
            assertTrue(events.stream().anyMatch(e -> e instanceof PluginRelaunchedEvent));
        }

        @Test
        @DisplayName("重启后的新一代再次崩溃同样触发重启")
        void everyGenerationShouldBeRelaunched() throws Exception {
            PluginSupervisor started = startJavaBackend("echo");

            assertThrows(ChannelBrokenException.class, () -> started.hooks().executeCommand(command("/exit")));
            assertEquals(2, started.getGeneration());

            assertThrows(ChannelBrokenException.class, () -> started.hooks().executeCommand(command("/exit")));
            assertEquals(3, started.getGeneration());
            assertEquals(SupervisorState.RUNNING, started.getState());
            assertEquals("/echo", started.hooks().executeCommand(command("/echo")).getText());
        }

        @Test
        @DisplayName("最终能在有限时间内恢复")
        void eventualRecovery() throws Exception {
            when(api.getPluginConfiguration()).thenReturn(
                    Map.of("shouldExit", true),
                    Map.of("shouldExit", false));
            PluginSupervisor started = startJavaBackend("echo");

            List<Throwable> failures = new CopyOnWriteArrayList<>();
            await().atMost(Duration.ofSeconds(30))
                    .pollInterval(Duration.ofMillis(100))
                    .until(() -> {
                        try {
                            started.hooks().onDeactivate();
                            return true;
                        } catch (ChannelBrokenException e) {
                            failures.add(e);
                            return false;
                        }
                    });

            assertFalse(failures.isEmpty());
            assertTrue(started.getGeneration() >= 2);
        }

        @Test
        @DisplayName("进程被外部杀死后由监控标记崩溃，下一次调用恢复")
        void externalKillShouldBeDetected() throws Exception {
            PluginSupervisor started = startJavaBackend("echo");
            long pid = started.getPid().getAsLong();

            ProcessHandle.of(pid).ifPresent(ProcessHandle::destroyForcibly);

            await().atMost(Duration.ofSeconds(10)).until(() -> started.getState() == SupervisorState.CRASHED);
            CommandResponse response = started.hooks().executeCommand(command("/echo back"));

            assertEquals("/echo back", response.getText());
            assertEquals(2, started.getGeneration());
            assertNotEquals(pid, started.getPid().getAsLong());
        }

        @Test
        @DisplayName("重启失败后保持崩溃状态")
        void failedRelaunchShouldStayCrashed() throws Exception {
            PluginSupervisor started = startJavaBackend("echo");
            // 后续启动都会立即退出
            BackendScripts.shell(root, "exit 4");

            assertThrows(ChannelBrokenException.class, () -> started.hooks().executeCommand(command("/exit")));
            assertEquals(SupervisorState.CRASHED, started.getState());

            ChannelBrokenException e = assertThrows(ChannelBrokenException.class,
                    () -> started.hooks().executeCommand(command("/echo")));
            assertInstanceOf(ExecutableLaunchFailedException.class, e.getCause());
            assertEquals(1, started.getGeneration());
        }

        @Test
        @DisplayName("同一次崩溃的并发观察者只触发一次重启")
        void concurrentObserversShouldShareOneRelaunch() throws Exception {
            PluginSupervisor started = startJavaBackend("echo");
            ProcessHandle.of(started.getPid().getAsLong()).ifPresent(ProcessHandle::destroyForcibly);
            await().atMost(Duration.ofSeconds(10)).until(() -> started.getState() == SupervisorState.CRASHED);

            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<String>> results = new ArrayList<>();
                for (int i = 0; i < 4; i++) {
                    results.add(pool.submit(() -> started.hooks().executeCommand(command("/echo")).getText()));
                }
                for (Future<String> result : results) {
                    assertEquals("/echo", result.get(60, TimeUnit.SECONDS));
                }
            } finally {
                pool.shutdownNow();
            }
            assertEquals(2, started.getGeneration());
        }
    }

    // ==================== 停止 ====================

    @Nested
    @DisplayName("停止")
    class StopTests {

        @Test
        @DisplayName("停止后进程退出且不再接受调用")
        void stopShouldTerminateProcess() throws Exception {
            PluginSupervisor started = startJavaBackend("echo");
            long pid = started.getPid().getAsLong();

            started.stop();

            assertEquals(SupervisorState.STOPPED, started.getState());
            assertFalse(BackendScripts.isAlive(pid));
            assertThrows(PluginNotRunningException.class, () -> started.hooks().onDeactivate());
            assertTrue(events.stream().anyMatch(e -> e instanceof PluginStoppedEvent));
        }

        @Test
        @DisplayName("停止可重复调用")
        void stopShouldBeIdempotent() throws Exception {
            PluginSupervisor started = startJavaBackend("noop");

            started.stop();
            assertDoesNotThrow(started::stop);
            assertEquals(SupervisorState.STOPPED, started.getState());
        }

        @Test
        @DisplayName("未启动时停止直接进入停止状态")
        void stopBeforeStart() throws Exception {
            BackendScripts.javaBackend(root, "noop");
            PluginSupervisor created = supervisorFor(config);

            created.stop();

            assertEquals(SupervisorState.STOPPED, created.getState());
            assertThrows(IllegalStateException.class, () -> created.start(api));
        }

        @Test
        @DisplayName("不肯退出的插件被强杀")
        void stubbornPluginShouldBeKilled() throws Exception {
            BackendScripts.javaBackend(root, "stubborn");
            PluginSupervisor started = supervisorFor(config.toBuilder()
                    .stopGracePeriod(Duration.ofMillis(500))
                    .build());
            started.start(api);
            long pid = started.getPid().getAsLong();

            assertDoesNotThrow(started::stop);

            assertFalse(BackendScripts.isAlive(pid));
        }

        @Test
        @DisplayName("停止后不触发崩溃事件")
        void stopShouldNotLookLikeCrash() throws Exception {
            PluginSupervisor started = startJavaBackend("echo");

            started.stop();
            Thread.sleep(300);

            assertTrue(events.stream().noneMatch(e -> e instanceof PluginCrashedEvent));
        }
    }
}
