package com.jz.chatflow.rag;

import com.jz.chatflow.domain.dto.ChatTurn;
import com.jz.chatflow.domain.entity.ConversationSession;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * 一次编排过程内的上下文，用完即弃。
 */
@Value
@Builder(toBuilder = true)
public class ConversationContext {
    String conversationKey;
    String utterance;

    /** 旧 → 新，不含当前这条 */
    @Builder.Default
    List<ChatTurn> history = List.of();
    @Builder.Default
    List<RetrievalMatch> matches = List.of();
    /** matches 用空行拼起来 */
    String contextBlock;
    boolean noKnowledge;
    @Builder.Default
    Set<String> scope = Set.of();

    /** 渠道绑定的提示词，可能为空 */
    String channelSystemPrompt;
    String senderName;
    /** 转写给的语言提示，可能为空 */
    String languageHint;
    ConversationSession session;

    /** 不需要检索时（固定话术/静默）用的最小上下文 */
    public static ConversationContext bare(String conversationKey, String utterance) {
        return ConversationContext.builder()
                .conversationKey(conversationKey)
                .utterance(utterance)
                .contextBlock("")
                .noKnowledge(true)
                .build();
    }
}
