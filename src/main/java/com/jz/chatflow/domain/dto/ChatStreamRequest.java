package com.jz.chatflow.domain.dto;

import lombok.Data;

import java.util.List;

@Data
public class ChatStreamRequest {
    private String sessionId;
    private String message;
    /** 用哪个业务号码绑定的知识范围回答 */
    private String businessNumber;
    /** 前端自己保存的对话，旧 → 新，不含本条；服务端不保存网页会话 */
    private List<Turn> history;

    @Data
    public static class Turn {
        /** user / assistant */
        private String role;
        private String content;

        public ChatTurn toChatTurn() {
            return "assistant".equalsIgnoreCase(role) ? ChatTurn.assistant(content) : ChatTurn.user(content);
        }
    }
}
