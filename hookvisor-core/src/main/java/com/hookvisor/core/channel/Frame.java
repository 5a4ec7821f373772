package com.hookvisor.core.channel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 通道帧
 * <p>
 * CALL 帧携带方法名与参数，REPLY 帧携带同一 id 的结果或错误。
 * id 由发起方分配，两个方向各自独立计数。
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Frame {

    public enum Kind {
        CALL,
        REPLY
    }

    private Kind kind;
    private long id;
    private String method;
    private List<JsonNode> args;
    private JsonNode result;
    private RemoteError error;

    public static Frame call(long id, String method, List<JsonNode> args) {
        Frame frame = new Frame();
        frame.kind = Kind.CALL;
        frame.id = id;
        frame.method = method;
        frame.args = args;
        return frame;
    }

    public static Frame reply(long id, JsonNode result) {
        Frame frame = new Frame();
        frame.kind = Kind.REPLY;
        frame.id = id;
        frame.result = result;
        return frame;
    }

    public static Frame failure(long id, RemoteError error) {
        Frame frame = new Frame();
        frame.kind = Kind.REPLY;
        frame.id = id;
        frame.error = error;
        return frame;
    }
}
