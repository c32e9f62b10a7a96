package com.jz.chatflow.chat.orchestrator;

import com.jz.chatflow.chat.dispatch.DispatchPolicy;
import com.jz.chatflow.chat.dispatch.Reply;
import com.jz.chatflow.chat.flow.RequiredAction;
import com.jz.chatflow.chat.flow.SessionStateMachine;
import com.jz.chatflow.chat.flow.Transition;
import com.jz.chatflow.chat.lock.ConversationLockManager;
import com.jz.chatflow.client.Collaborator;
import com.jz.chatflow.client.CollaboratorGuard;
import com.jz.chatflow.client.DeliveryClient;
import com.jz.chatflow.client.DeliveryCredentials;
import com.jz.chatflow.client.Transcript;
import com.jz.chatflow.client.TranscriptionClient;
import com.jz.chatflow.domain.dto.ContentKind;
import com.jz.chatflow.domain.dto.InboundEvent;
import com.jz.chatflow.domain.entity.ConversationSession;
import com.jz.chatflow.exception.CollaboratorException;
import com.jz.chatflow.exception.ConfigurationMissingException;
import com.jz.chatflow.exception.ConversationBusyException;
import com.jz.chatflow.rag.ConversationContext;
import com.jz.chatflow.rag.RetrievalAssembler;
import com.jz.chatflow.service.ChannelDirectory;
import com.jz.chatflow.service.EventStore;
import com.jz.chatflow.service.SessionStore;
import com.jz.chatflow.utils.ConversationKeys;
import com.jz.chatflow.utils.TextSanitizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 入站事件编排：去重 → 转写 → 渠道配置 → [会话锁内] 状态机 → 检索 → 回复策略 → 发送 → 落库。
 *
 * <p>handle 不向外抛异常，所有结果都折叠成 {@link Outcome}。</p>
 */
@Slf4j
@Service
public class ConversationOrchestrator {

    private final EventStore eventStore;
    private final SessionStore sessionStore;
    private final ChannelDirectory channelDirectory;
    private final SessionStateMachine stateMachine;
    private final RetrievalAssembler retrievalAssembler;
    private final DispatchPolicy dispatchPolicy;
    private final TranscriptionClient transcriptionClient;
    private final DeliveryClient deliveryClient;
    private final CollaboratorGuard guard;
    private final ConversationLockManager lockManager;

    private final Timer handleTimer;
    private final Map<Outcome, Counter> outcomeCounters = new EnumMap<>(Outcome.class);

    public ConversationOrchestrator(EventStore eventStore,
                                    SessionStore sessionStore,
                                    ChannelDirectory channelDirectory,
                                    SessionStateMachine stateMachine,
                                    RetrievalAssembler retrievalAssembler,
                                    DispatchPolicy dispatchPolicy,
                                    TranscriptionClient transcriptionClient,
                                    DeliveryClient deliveryClient,
                                    CollaboratorGuard guard,
                                    ConversationLockManager lockManager,
                                    MeterRegistry meterRegistry) {
        this.eventStore = eventStore;
        this.sessionStore = sessionStore;
        this.channelDirectory = channelDirectory;
        this.stateMachine = stateMachine;
        this.retrievalAssembler = retrievalAssembler;
        this.dispatchPolicy = dispatchPolicy;
        this.transcriptionClient = transcriptionClient;
        this.deliveryClient = deliveryClient;
        this.guard = guard;
        this.lockManager = lockManager;

        this.handleTimer = Timer.builder("chatflow.handle.latency")
                .description("inbound event handling latency")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(meterRegistry);
        for (Outcome o : Outcome.values()) {
            outcomeCounters.put(o, Counter.builder("chatflow.events")
                    .tag("outcome", o.name())
                    .register(meterRegistry));
        }
    }

    public HandledOutcome handle(InboundEvent event) {
        long t0 = System.nanoTime();
        HandledOutcome out;
        try {
            out = doHandle(event);
        } catch (Exception e) {
            log.error("handle failed messageId={}, key={}, err={}", event.getId(), safeKey(event), e.getMessage(), e);
            out = HandledOutcome.of(event.getId(), safeKey(event), Outcome.FAILED);
        }
        handleTimer.record(System.nanoTime() - t0, TimeUnit.NANOSECONDS);
        outcomeCounters.get(out.getOutcome()).increment();
        log.info("handled messageId={}, key={}, outcome={}, stage={}",
                out.getMessageId(), out.getConversationKey(), out.getOutcome(), out.getStage());
        return out;
    }

    private HandledOutcome doHandle(InboundEvent event) {
        String key = event.conversationKey();

        // 1) 去重：唯一键插入
        if (!eventStore.recordInbound(event)) {
            return HandledOutcome.of(event.getId(), key, Outcome.DUPLICATE);
        }

        // 2) 回执/回显只落库
        if (!event.isUserOriginated()) {
            return HandledOutcome.of(event.getId(), key, Outcome.IGNORED);
        }

        // 3) 语音先转写
        String text = event.getRawText();
        String languageHint = null;
        if (event.getKind() == ContentKind.AUDIO) {
            Optional<Transcript> transcript = transcribe(event);
            if (transcript.isEmpty()) {
                return HandledOutcome.of(event.getId(), key, Outcome.TRANSCRIPTION_FAILED);
            }
            text = transcript.get().getText();
            languageHint = transcript.get().getLanguage();
            eventStore.fillTranscript(event.getId(), text);
        }

        if (text == null || text.isBlank()) {
            return HandledOutcome.of(event.getId(), key, Outcome.EMPTY);
        }

        // 4) 渠道凭证
        DeliveryCredentials credentials;
        try {
            credentials = channelDirectory.profileOf(ConversationKeys.parseBusiness(key)).requireCredentials();
        } catch (ConfigurationMissingException e) {
            log.error("channel not configured, key={}, err={}", key, e.getMessage());
            return HandledOutcome.of(event.getId(), key, Outcome.CONFIGURATION_MISSING);
        }

        // 5) 会话锁内推进状态并回复
        final String utterance = text.trim();
        final String hint = languageHint;
        try {
            return lockManager.withLock(key, () -> processLocked(event, key, utterance, hint, credentials));
        } catch (ConversationBusyException e) {
            log.warn("conversation busy, event left unresponded. messageId={}, err={}", event.getId(), e.getMessage());
            return HandledOutcome.of(event.getId(), key, Outcome.FAILED);
        }
    }

    private HandledOutcome processLocked(InboundEvent event, String key, String utterance,
                                         String languageHint, DeliveryCredentials credentials) {
        ConversationSession session = sessionStore.loadOrCreate(key);
        Transition t = stateMachine.transition(session, utterance);
        ConversationSession next = t.getSession();
        RequiredAction action = t.getAction();

        ConversationContext ctx = action.isGenerate()
                ? retrievalAssembler.assemble(utterance, key, event.getId())
                : ConversationContext.bare(key, utterance);
        ctx = ctx.toBuilder()
                .senderName(event.getSenderDisplayName())
                .languageHint(languageHint)
                .session(next)
                .build();

        Reply reply = dispatchPolicy.decide(next, ctx, action);
        if (!reply.isPresent()) {
            sessionStore.upsert(next);
            return new HandledOutcome(event.getId(), key, Outcome.SILENCED, next.getStage(), null);
        }

        String destination = ConversationKeys.parseUser(key);
        try {
            guard.run(Collaborator.DELIVERY, () -> deliveryClient.send(destination, reply.getText(), credentials));
        } catch (CollaboratorException e) {
            // 状态照样保存，回复挂起等按会话重发
            log.error("delivery failed, reply parked. key={}, messageId={}, err={}", key, event.getId(), e.getMessage());
            next.setPendingReply(reply.getText());
            next.setPendingReplyEventId(event.getId());
            sessionStore.upsert(next);
            return new HandledOutcome(event.getId(), key, Outcome.DELIVERY_FAILED, next.getStage(), reply.getText());
        }

        next.setPendingReply(null);
        next.setPendingReplyEventId(null);
        try {
            sessionStore.upsert(next);
        } catch (RuntimeException e) {
            log.error("session save failed after delivery, key={}, err={}", key, e.getMessage(), e);
        }
        recordDelivered(key, event.getId(), reply.getText());
        log.info("replied key={}, source={}, greeted={}, text={}", key, reply.getSource(), reply.isGreeted(),
                TextSanitizer.preview(reply.getText()));
        return new HandledOutcome(event.getId(), key, Outcome.REPLIED, next.getStage(), reply.getText());
    }

    /**
     * 已送达之后的落库：出站记录失败不影响“已回复”标记。
     */
    void recordDelivered(String key, String inboundMessageId, String text) {
        try {
            eventStore.recordOutbound(key, inboundMessageId, text);
        } catch (RuntimeException e) {
            log.error("record outbound failed after delivery, key={}, inbound={}, err={}", key, inboundMessageId, e.getMessage());
        }
        try {
            eventStore.markResponded(inboundMessageId);
        } catch (RuntimeException e) {
            log.error("mark responded failed, key={}, inbound={}, err={}", key, inboundMessageId, e.getMessage());
        }
    }

    private Optional<Transcript> transcribe(InboundEvent event) {
        if (event.getMediaRef() == null || event.getMediaRef().isBlank()) {
            log.warn("audio event without media, messageId={}", event.getId());
            return Optional.empty();
        }
        try {
            Optional<Transcript> t = guard.call(Collaborator.TRANSCRIPTION,
                    () -> transcriptionClient.transcribe(event.getMediaRef()));
            if (t == null || t.isEmpty() || t.get().getText() == null || t.get().getText().isBlank()) {
                log.warn("empty transcript, messageId={}", event.getId());
                return Optional.empty();
            }
            return t;
        } catch (CollaboratorException e) {
            log.warn("transcription failed, messageId={}, timeout={}, err={}", event.getId(), e.isTimeout(), e.getMessage());
            return Optional.empty();
        }
    }

    private static String safeKey(InboundEvent event) {
        try {
            return event.conversationKey();
        } catch (RuntimeException e) {
            return null;
        }
    }
}
