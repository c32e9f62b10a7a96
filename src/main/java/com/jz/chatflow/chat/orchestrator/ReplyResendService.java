package com.jz.chatflow.chat.orchestrator;

import com.jz.chatflow.chat.lock.ConversationLockManager;
import com.jz.chatflow.client.Collaborator;
import com.jz.chatflow.client.CollaboratorGuard;
import com.jz.chatflow.client.DeliveryClient;
import com.jz.chatflow.client.DeliveryCredentials;
import com.jz.chatflow.domain.entity.ConversationSession;
import com.jz.chatflow.exception.CollaboratorException;
import com.jz.chatflow.exception.ConfigurationMissingException;
import com.jz.chatflow.service.ChannelDirectory;
import com.jz.chatflow.service.EventStore;
import com.jz.chatflow.service.SessionStore;
import com.jz.chatflow.utils.ConversationKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 按会话重发挂起的回复（发送失败后由运维/上游显式触发），不重放原事件。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReplyResendService {

    public enum Status {
        RESENT,
        NOTHING_PENDING,
        DELIVERY_FAILED,
        CONFIGURATION_MISSING
    }

    private final SessionStore sessionStore;
    private final EventStore eventStore;
    private final ChannelDirectory channelDirectory;
    private final DeliveryClient deliveryClient;
    private final CollaboratorGuard guard;
    private final ConversationLockManager lockManager;
    private final ConversationOrchestrator orchestrator;

    public Status resend(String conversationKey) {
        String business = ConversationKeys.parseBusiness(conversationKey);
        String user = ConversationKeys.parseUser(conversationKey);
        if (business == null || user == null) {
            throw new IllegalArgumentException("malformed conversation key: " + conversationKey);
        }
        return lockManager.withLock(conversationKey, () -> {
            Optional<ConversationSession> found = sessionStore.find(conversationKey);
            if (found.isEmpty() || found.get().getPendingReply() == null || found.get().getPendingReply().isBlank()) {
                return Status.NOTHING_PENDING;
            }
            ConversationSession session = found.get();
            String inboundId = session.getPendingReplyEventId();

            // 上次重发已送达但会话没存上：只清挂起，不再发
            if (inboundId != null && eventStore.isResponded(inboundId)) {
                log.warn("parked reply already delivered, clearing. key={}, inbound={}", conversationKey, inboundId);
                clearParked(session);
                return Status.NOTHING_PENDING;
            }

            DeliveryCredentials credentials;
            try {
                credentials = channelDirectory.profileOf(business).requireCredentials();
            } catch (ConfigurationMissingException e) {
                log.error("resend aborted, channel not configured. key={}", conversationKey);
                return Status.CONFIGURATION_MISSING;
            }

            String text = session.getPendingReply();
            try {
                guard.run(Collaborator.DELIVERY, () -> deliveryClient.send(user, text, credentials));
            } catch (CollaboratorException e) {
                log.warn("resend failed, reply stays parked. key={}, err={}", conversationKey, e.getMessage());
                return Status.DELIVERY_FAILED;
            }

            clearParked(session);
            orchestrator.recordDelivered(conversationKey, inboundId == null ? "resend" : inboundId, text);
            log.info("parked reply resent, key={}, inbound={}", conversationKey, inboundId);
            return Status.RESENT;
        });
    }

    private void clearParked(ConversationSession session) {
        session.setPendingReply(null);
        session.setPendingReplyEventId(null);
        try {
            sessionStore.upsert(session);
        } catch (RuntimeException e) {
            log.error("session save failed after resend, key={}, err={}",
                    session.getConversationKey(), e.getMessage(), e);
        }
    }
}
