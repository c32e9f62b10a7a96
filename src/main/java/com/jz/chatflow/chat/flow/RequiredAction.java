package com.jz.chatflow.chat.flow;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * 状态机给出的“下一步该做什么”，由 DispatchPolicy 执行。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RequiredAction {

    public enum Kind {
        GENERATE_REPLY,
        SEND_CANNED,
        /** 故意不回（已 STOPPED） */
        SUPPRESS
    }

    Kind kind;
    String cannedText;
    /** 还需要追问的字段；空 = 不限定 */
    List<String> askFields;
    /** 信息已齐，回复可以基于完整上下文确认 */
    boolean fullContext;

    public static RequiredAction generateFull() {
        return new RequiredAction(Kind.GENERATE_REPLY, null, List.of(), true);
    }

    public static RequiredAction generateAsking(List<String> remaining) {
        return new RequiredAction(Kind.GENERATE_REPLY, null, List.copyOf(remaining), false);
    }

    public static RequiredAction canned(String text) {
        return new RequiredAction(Kind.SEND_CANNED, text, List.of(), false);
    }

    public static RequiredAction suppress() {
        return new RequiredAction(Kind.SUPPRESS, null, List.of(), false);
    }

    public boolean isGenerate() {
        return kind == Kind.GENERATE_REPLY;
    }
}
