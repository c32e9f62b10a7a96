package com.jz.chatflow.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 业务号码 ↔ 知识文件的绑定，一个号码可以有多行（每个文件一行），
 * 发送凭证和渠道自己的 system prompt 也挂在这里。
 */
@Data
@TableName("channel_binding")
public class ChannelBinding {
    @TableId(type = IdType.AUTO)
    private Long id;

    private String phoneNumber;
    private String fileId;

    private String intent;
    @TableField("system_prompt")
    private String systemPrompt;

    private String authToken;
    private String origin;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;
}
