package com.jz.chatflow.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 每个 conversationKey 一条；不物理删除，重置只是把状态清回初始。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@TableName(value = "conversation_session", autoResultMap = true)
public class ConversationSession {

    public static final String TOPIC_SLOT = "topic";

    @TableId(type = IdType.AUTO)
    private Long id;

    private String conversationKey;

    private SessionStage stage;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, String> slots;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<String> pendingFields;

    private String lastUserText;

    // 生成了但没发出去的回复，留给按会话的重发通道
    private String pendingReply;
    private String pendingReplyEventId;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public static ConversationSession fresh(String conversationKey) {
        return ConversationSession.builder()
                .conversationKey(conversationKey)
                .stage(SessionStage.INIT)
                .slots(new LinkedHashMap<>())
                .pendingFields(new ArrayList<>())
                .build();
    }

    /** 深拷贝 slots/pendingFields，状态机在副本上推进 */
    public ConversationSession copy() {
        return toBuilder()
                .slots(slots == null ? new LinkedHashMap<>() : new LinkedHashMap<>(slots))
                .pendingFields(pendingFields == null ? new ArrayList<>() : new ArrayList<>(pendingFields))
                .build();
    }

    public String topic() {
        return slots == null ? null : slots.get(TOPIC_SLOT);
    }
}
