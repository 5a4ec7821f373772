package com.hookvisor.core.rpc;

import com.hookvisor.api.model.CommandArgs;
import com.hookvisor.api.model.CommandResponse;
import com.hookvisor.api.model.HttpResponseData;
import com.hookvisor.api.plugin.PluginHooks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HookMethod 单元测试")
public class HookMethodTest {

    static class CommandOnly implements PluginHooks {
        @Override
        public CommandResponse executeCommand(CommandArgs args) {
            return CommandResponse.ephemeral("ok");
        }
    }

    @Test
    @DisplayName("只识别实现类覆盖了的钩子")
    void overriddenHooksShouldBeDetected() {
        CommandOnly hooks = new CommandOnly();

        assertTrue(HookMethod.EXECUTE_COMMAND.isOverriddenBy(hooks));
        assertFalse(HookMethod.SERVE_HTTP.isOverriddenBy(hooks));
        assertFalse(HookMethod.ON_DEACTIVATE.isOverriddenBy(hooks));
        assertFalse(HookMethod.HANDSHAKE.isOverriddenBy(hooks));
    }

    @Test
    @DisplayName("默认结果来自接口默认实现")
    void defaultResultsShouldComeFromInterface() {
        assertNull(HookMethod.EXECUTE_COMMAND.defaultResult(new Object[]{null}));
        assertEquals(404, ((HttpResponseData) HookMethod.SERVE_HTTP.defaultResult(new Object[]{null})).getStatus());
        assertNull(HookMethod.ON_DEACTIVATE.defaultResult());
    }

    @Test
    @DisplayName("控制调用没有默认结果")
    void controlCallsHaveNoDefault() {
        assertThrows(IllegalStateException.class, () -> HookMethod.SHUTDOWN.defaultResult());
    }

    @Test
    @DisplayName("按远程方法名查找")
    void lookupByWireName() {
        assertEquals(HookMethod.SERVE_HTTP, HookMethod.fromWireName("Plugin.ServeHttp").orElseThrow());
        assertTrue(HookMethod.fromWireName("Plugin.Unknown").isEmpty());
    }
}
