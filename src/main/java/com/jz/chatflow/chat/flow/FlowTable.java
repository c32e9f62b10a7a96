package com.jz.chatflow.chat.flow;

import com.jz.chatflow.config.ConversationFlowProperties;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 编译好的对话流配置（不可变）。状态机只认这张表，不认具体业务。
 */
@Getter
public final class FlowTable {

    /** 一个话题：触发词 + 按顺序追问的必填字段 */
    public record TopicRule(String name, Lexicon keywords, List<String> requiredFields) {}

    public record FieldRule(FieldType type, FieldMatcher matcher) {
        public boolean isFreeText() {
            return type == FieldType.FREE_TEXT;
        }
    }

    private final Lexicon resetLexicon;
    private final Lexicon rejectLexicon;
    private final String politeClose;
    private final List<TopicRule> topics;
    private final Map<String, FieldRule> fields;

    public FlowTable(Lexicon resetLexicon, Lexicon rejectLexicon, String politeClose,
                     List<TopicRule> topics, Map<String, FieldRule> fields) {
        this.resetLexicon = resetLexicon;
        this.rejectLexicon = rejectLexicon;
        this.politeClose = politeClose;
        this.topics = List.copyOf(topics);
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        for (TopicRule t : this.topics) {
            for (String f : t.requiredFields()) {
                if (!this.fields.containsKey(f)) {
                    throw new IllegalStateException("topic '" + t.name() + "' requires undeclared field '" + f + "'");
                }
            }
        }
    }

    public static FlowTable from(ConversationFlowProperties props) {
        Map<String, FieldRule> fields = new LinkedHashMap<>();
        props.getFields().forEach((name, def) ->
                fields.put(name, new FieldRule(def.getType(), FieldMatchers.of(def.getType(), def.getPattern()))));

        List<TopicRule> topics = new ArrayList<>();
        for (ConversationFlowProperties.Topic t : props.getTopics()) {
            topics.add(new TopicRule(t.getName(), Lexicon.wholeWords(t.getKeywords()),
                    List.copyOf(t.getRequiredFields())));
        }
        return new FlowTable(
                Lexicon.substrings(props.getResetKeywords()),
                Lexicon.wholeWords(props.getRejectKeywords()),
                props.getPoliteCloseMessage(),
                topics,
                fields);
    }

    /** 按声明顺序找第一个命中的话题 */
    public Optional<TopicRule> detectTopic(String utterance) {
        for (TopicRule t : topics) {
            if (t.keywords().matches(utterance)) return Optional.of(t);
        }
        return Optional.empty();
    }

    public FieldRule fieldOf(String field) {
        return fields.get(field);
    }
}
