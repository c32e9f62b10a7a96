package com.jz.chatflow.config;

import com.jz.chatflow.chat.flow.FieldType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 会话状态机的声明式配置：重置词、拒绝词、话题 → 必填字段、字段 → 匹配器。
 * 字段的声明顺序就是追问顺序。
 */
@Data
@ConfigurationProperties(prefix = "chatflow.flow")
public class ConversationFlowProperties {

    /** 命中即回到 INIT（大小写不敏感，子串匹配） */
    private List<String> resetKeywords = new ArrayList<>(List.of("reset", "restart", "start over"));

    /** 命中即进入 STOPPED（大小写不敏感，整词/短语匹配）；与重置词同时命中时拒绝优先 */
    private List<String> rejectKeywords = new ArrayList<>(List.of(
            "no", "nahi", "nahin", "not interested", "thanks", "thank you", "later"));

    private String politeCloseMessage = "Theek hai 😊 Agar future me help chahiye ho to bataiyega.";

    private List<Topic> topics = new ArrayList<>();

    private Map<String, Field> fields = new LinkedHashMap<>();

    @Data
    public static class Topic {
        private String name;
        private List<String> keywords = new ArrayList<>();
        private List<String> requiredFields = new ArrayList<>();
    }

    @Data
    public static class Field {
        private FieldType type = FieldType.FREE_TEXT;
        /** 仅 REGEX 类型使用；第一个捕获组（没有则整段）作为取值 */
        private String pattern;
    }
}
