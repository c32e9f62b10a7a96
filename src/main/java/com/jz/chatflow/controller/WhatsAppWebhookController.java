package com.jz.chatflow.controller;

import com.jz.chatflow.chat.orchestrator.ConversationOrchestrator;
import com.jz.chatflow.chat.orchestrator.HandledOutcome;
import com.jz.chatflow.chat.orchestrator.ReplyResendService;
import com.jz.chatflow.common.Result;
import com.jz.chatflow.domain.dto.ResendAckDTO;
import com.jz.chatflow.domain.dto.WebhookAckDTO;
import com.jz.chatflow.domain.dto.WhatsAppWebhookPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("api/webhook/whatsapp")
@RequiredArgsConstructor
public class WhatsAppWebhookController {

    private final ConversationOrchestrator orchestrator;
    private final ReplyResendService resendService;

    /** 服务商回调入口。重复投递也返回 200，避免上游无限重试 */
    @PostMapping
    public ResponseEntity<Result<WebhookAckDTO>> receive(@RequestBody WhatsAppWebhookPayload payload) {
        if (payload == null || !payload.hasIdentity()) {
            log.warn("webhook rejected: missing messageId/from/to");
            return ResponseEntity.badRequest().body(Result.badRequest("messageId, from and to are required"));
        }
        HandledOutcome out = orchestrator.handle(payload.toInboundEvent());
        WebhookAckDTO ack = WebhookAckDTO.builder()
                .messageId(out.getMessageId())
                .outcome(out.getOutcome().name())
                .duplicate(out.isDuplicate())
                .stage(out.getStage() == null ? null : out.getStage().name())
                .build();
        return ResponseEntity.ok(Result.success(ack));
    }

    /** 发送失败后按会话重发挂起的回复 */
    @PostMapping("/sessions/{conversationKey}/resend")
    public Result<ResendAckDTO> resend(@PathVariable String conversationKey) {
        ReplyResendService.Status status = resendService.resend(conversationKey);
        return Result.success(new ResendAckDTO(conversationKey, status.name()));
    }
}
