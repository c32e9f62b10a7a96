package com.jz.chatflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "chatflow.dispatch")
public class DispatchProperties {

    public enum NoKnowledgeMode {
        /** 直接回固定的“暂无信息”话术，不调模型 */
        CANNED,
        /** 照常调模型，但明确告知上下文为空 */
        GENERATE
    }

    private NoKnowledgeMode noKnowledgeMode = NoKnowledgeMode.GENERATE;

    /** 渠道没有绑定自己的 system prompt 时使用 */
    private String defaultSystemPrompt = "You are a helpful WhatsApp assistant.";

    private int maxReplyChars = 700;

    private boolean greetingEnabled = true;

    /** %s = 清洗后的发送者名字 */
    private String greetingTemplate = "Hi %s 😊";

    /** 不允许出现在回复里的内部词汇 */
    private List<String> internalVocabulary = new ArrayList<>(List.of(
            "document", "documents", "dataset", "knowledge base", "training data", "source"));
}
