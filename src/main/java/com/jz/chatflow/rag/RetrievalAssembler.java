package com.jz.chatflow.rag;

import com.jz.chatflow.client.Collaborator;
import com.jz.chatflow.client.CollaboratorGuard;
import com.jz.chatflow.client.EmbeddingClient;
import com.jz.chatflow.config.RetrievalProperties;
import com.jz.chatflow.domain.dto.ChannelProfile;
import com.jz.chatflow.domain.dto.ChatTurn;
import com.jz.chatflow.exception.CollaboratorException;
import com.jz.chatflow.service.ChannelDirectory;
import com.jz.chatflow.service.EventStore;
import com.jz.chatflow.utils.ConversationKeys;
import com.jz.chatflow.utils.TextSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 检索上下文组装：范围 → 向量 → KNN → 排序截断 → 拼上下文块 + 近期历史。
 * 向量/检索失败只降级成“无资料”，不往外抛。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetrievalAssembler {

    private final ChannelDirectory channelDirectory;
    private final EventStore eventStore;
    private final EmbeddingClient embeddingClient;
    private final KnowledgeIndex knowledgeIndex;
    private final CollaboratorGuard guard;
    private final RetrievalProperties props;

    public ConversationContext assemble(String utteranceText, String conversationKey) {
        return assemble(utteranceText, conversationKey, null);
    }

    /**
     * @param currentMessageId 当前入站事件，不放进历史
     */
    public ConversationContext assemble(String utteranceText, String conversationKey, String currentMessageId) {
        ChannelProfile profile = channelDirectory.profileOf(ConversationKeys.parseBusiness(conversationKey));
        List<ChatTurn> history = eventStore.recentHistory(conversationKey, currentMessageId, props.getHistorySize());
        return build(utteranceText, conversationKey, profile, history);
    }

    /**
     * 网页端：历史由调用方带上来，只取最近 historySize 轮，不读 WhatsApp 的会话记录。
     */
    public ConversationContext assembleWithHistory(String utteranceText, String businessNumber,
                                                   String conversationKey, List<ChatTurn> clientHistory) {
        ChannelProfile profile = channelDirectory.profileOf(businessNumber);
        List<ChatTurn> history = lastTurns(clientHistory, props.getHistorySize());
        return build(utteranceText, conversationKey, profile, history);
    }

    private ConversationContext build(String utteranceText, String conversationKey,
                                      ChannelProfile profile, List<ChatTurn> history) {
        Set<String> scope = profile.getKnowledgeScope();
        List<RetrievalMatch> matches = retrieve(utteranceText, scope, conversationKey);
        String block = matches.stream().map(RetrievalMatch::getChunkText).collect(Collectors.joining("\n\n"));

        return ConversationContext.builder()
                .conversationKey(conversationKey)
                .utterance(utteranceText)
                .history(history)
                .matches(matches)
                .contextBlock(block)
                .noKnowledge(matches.isEmpty())
                .scope(scope)
                .channelSystemPrompt(profile.getSystemPrompt())
                .build();
    }

    private static List<ChatTurn> lastTurns(List<ChatTurn> turns, int limit) {
        if (turns == null || turns.isEmpty() || limit <= 0) return List.of();
        List<ChatTurn> kept = new ArrayList<>();
        for (ChatTurn t : turns) {
            if (t != null && t.getRole() != null && t.getText() != null && !t.getText().isBlank()) kept.add(t);
        }
        return kept.size() <= limit ? List.copyOf(kept) : List.copyOf(kept.subList(kept.size() - limit, kept.size()));
    }

    private List<RetrievalMatch> retrieve(String text, Set<String> scope, String key) {
        if (scope == null || scope.isEmpty()) {
            log.info("no knowledge scope bound, key={}", key);
            return List.of();
        }
        if (text == null || text.isBlank()) return List.of();

        float[] vector;
        try {
            vector = guard.call(Collaborator.EMBEDDING, () -> embeddingClient.embed(text));
        } catch (CollaboratorException e) {
            log.warn("embedding failed, continue without knowledge. key={}, err={}", key, e.getMessage());
            return List.of();
        }

        List<RetrievalMatch> raw;
        try {
            raw = guard.call(Collaborator.KNOWLEDGE_INDEX, () -> knowledgeIndex.query(vector, scope, props.getTopK()));
        } catch (CollaboratorException e) {
            log.warn("knowledge query failed, continue without knowledge. key={}, err={}", key, e.getMessage());
            return List.of();
        }
        List<RetrievalMatch> ranked = rank(raw, props.getTopK(), props.getMinScore());
        log.debug("retrieved key={}, q={}, hits={}", key, TextSanitizer.preview(text, 40), ranked.size());
        return ranked;
    }

    /** 分数降序；同分保持索引返回顺序（List.sort 是稳定排序） */
    static List<RetrievalMatch> rank(List<RetrievalMatch> raw, int topK, double minScore) {
        if (raw == null || raw.isEmpty()) return List.of();
        List<RetrievalMatch> list = new ArrayList<>();
        for (RetrievalMatch m : raw) {
            if (m != null && m.getScore() >= minScore) list.add(m);
        }
        list.sort(Comparator.comparingDouble(RetrievalMatch::getScore).reversed());
        return list.size() > topK ? List.copyOf(list.subList(0, topK)) : List.copyOf(list);
    }
}
