package com.jz.chatflow.chat.flow;

import com.jz.chatflow.domain.entity.ConversationSession;
import com.jz.chatflow.domain.entity.SessionStage;
import com.jz.chatflow.utils.TextSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 会话状态机：纯函数，不做 IO。入参 session 不会被修改，返回推进后的副本。
 *
 * <p>判定顺序：拒绝 → 重置 → STOPPED 静默 → 话题识别 → 字段抽取。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionStateMachine {

    private final FlowTable flow;

    public Transition transition(ConversationSession current, String utterance) {
        ConversationSession s = current.copy();
        String text = utterance == null ? "" : utterance.trim();
        s.setLastUserText(text);
        boolean stopped = s.getStage() == SessionStage.STOPPED;

        // 1) 拒绝优先于重置
        if (flow.getRejectLexicon().matches(text)) {
            if (stopped) {
                return new Transition(s, RequiredAction.suppress(), Map.of());
            }
            s.setStage(SessionStage.STOPPED);
            log.info("session stopped by reject key={}, text={}", s.getConversationKey(), TextSanitizer.preview(text));
            return new Transition(s, RequiredAction.canned(flow.getPoliteClose()), Map.of());
        }

        // 2) 重置：清空，当前这句不再触发话题
        if (flow.getResetLexicon().matches(text)) {
            s.getSlots().clear();
            s.getPendingFields().clear();
            s.setStage(SessionStage.INIT);
            log.info("session reset key={}", s.getConversationKey());
            return new Transition(s, RequiredAction.generateFull(), Map.of());
        }

        // 3) 已停止：不抽取、不回复
        if (stopped) {
            return new Transition(s, RequiredAction.suppress(), Map.of());
        }

        boolean seeded = false;
        if (s.getStage() == SessionStage.INIT || s.getStage() == null) {
            Optional<FlowTable.TopicRule> topic = flow.detectTopic(text);
            if (topic.isPresent()) {
                s.getSlots().put(ConversationSession.TOPIC_SLOT, topic.get().name());
                for (String f : topic.get().requiredFields()) {
                    if (!s.getSlots().containsKey(f) && !s.getPendingFields().contains(f)) {
                        s.getPendingFields().add(f);
                    }
                }
                seeded = true;
            }
        }

        Map<String, String> captured = extract(s, text, seeded);
        s.setStage(SessionStage.derive(false, s.getSlots(), s.getPendingFields()));

        if (!captured.isEmpty()) {
            log.debug("fields captured key={}, captured={}, remaining={}",
                    s.getConversationKey(), captured, s.getPendingFields());
        }

        if (s.getStage() == SessionStage.COLLECTING) {
            return new Transition(s, RequiredAction.generateAsking(s.getPendingFields()), captured);
        }
        return new Transition(s, RequiredAction.generateFull(), captured);
    }

    /**
     * 按 pending 顺序逐个匹配。已有值的字段不覆盖。
     * FREE_TEXT 这类“什么都能匹配”的字段只在本轮没有别的字段命中、且不是刚识别话题那一句时才取。
     */
    private Map<String, String> extract(ConversationSession s, String text, boolean seededThisTurn) {
        Map<String, String> captured = new LinkedHashMap<>();
        if (text.isEmpty() || s.getPendingFields().isEmpty()) return captured;

        List<String> freeTextCandidates = new ArrayList<>();
        Iterator<String> it = s.getPendingFields().iterator();
        while (it.hasNext()) {
            String field = it.next();
            FlowTable.FieldRule rule = flow.fieldOf(field);
            if (rule == null) continue;
            if (rule.isFreeText()) {
                freeTextCandidates.add(field);
                continue;
            }
            if (s.getSlots().containsKey(field)) {
                it.remove();
                continue;
            }
            Optional<String> v = rule.matcher().match(text);
            if (v.isPresent()) {
                s.getSlots().put(field, v.get());
                captured.put(field, v.get());
                it.remove();
            }
        }

        if (captured.isEmpty() && !seededThisTurn && !freeTextCandidates.isEmpty()) {
            String field = freeTextCandidates.get(0);
            if (!s.getSlots().containsKey(field)) {
                s.getSlots().put(field, text);
                captured.put(field, text);
            }
            s.getPendingFields().remove(field);
        }
        return captured;
    }
}
