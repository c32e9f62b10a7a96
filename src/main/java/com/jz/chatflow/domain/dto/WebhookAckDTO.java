package com.jz.chatflow.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookAckDTO {
    private String messageId;
    private String outcome;
    /** 重复投递：照样返回成功，避免上游无限重试 */
    private boolean duplicate;
    private String stage;
}
