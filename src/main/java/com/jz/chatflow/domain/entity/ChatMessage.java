package com.jz.chatflow.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 收发消息流水。message_id 上有唯一索引，入站去重就靠它。
 * 除 responded/respondedAt 外写入后不再修改（语音消息的转写文本只补写一次）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("chat_message")
public class ChatMessage {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String messageId;                // 服务商事件ID；出站为 auto_{inboundId}_{ts}
    private String conversationKey;          // "wa:{from}:{to}"

    private MessageDirection direction;
    private String contentKind;              // text / audio
    private String text;
    private String mediaRef;
    private String senderName;
    private String eventKind;                // MoMessage / MtMessage / 回执...

    private Boolean responded;
    private LocalDateTime respondedAt;

    private Long seq;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
}
