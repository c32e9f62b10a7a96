package com.jz.chatflow.chat.dispatch;

import com.jz.chatflow.chat.flow.RequiredAction;
import com.jz.chatflow.chat.language.LanguageDetector;
import com.jz.chatflow.chat.language.ReplyLanguage;
import com.jz.chatflow.chat.prompt.ReplyPromptComposer;
import com.jz.chatflow.client.Collaborator;
import com.jz.chatflow.client.CollaboratorGuard;
import com.jz.chatflow.client.GenerationClient;
import com.jz.chatflow.client.GenerationRequest;
import com.jz.chatflow.config.CollaboratorProperties;
import com.jz.chatflow.config.DispatchProperties;
import com.jz.chatflow.domain.entity.ConversationSession;
import com.jz.chatflow.exception.CollaboratorException;
import com.jz.chatflow.rag.ConversationContext;
import com.jz.chatflow.service.EventStore;
import com.jz.chatflow.utils.TextSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 回复策略：执行状态机给出的动作，保证任何情况下都有一条可发的文本（SUPPRESS 除外）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchPolicy {

    private final GenerationClient generationClient;
    private final CollaboratorGuard guard;
    private final LanguageDetector languageDetector;
    private final ReplyPromptComposer promptComposer;
    private final EventStore eventStore;
    private final DispatchProperties props;
    private final CollaboratorProperties collaboratorProps;

    public Reply decide(ConversationSession session, ConversationContext ctx, RequiredAction action) {
        switch (action.getKind()) {
            case SUPPRESS:
                return Reply.none();
            case SEND_CANNED:
                return Reply.canned(action.getCannedText());
            default:
                break;
        }

        ConversationContext withSession = ctx.getSession() == null ? ctx.toBuilder().session(session).build() : ctx;
        ReplyLanguage lang = languageDetector.detect(ctx.getUtterance(), ctx.getLanguageHint());
        String body;
        Reply.Source source;

        if (ctx.isNoKnowledge() && props.getNoKnowledgeMode() == DispatchProperties.NoKnowledgeMode.CANNED) {
            body = lang.fallbackText();
            source = Reply.Source.FALLBACK;
        } else {
            Optional<String> generated = generate(withSession, action, lang);
            if (generated.isPresent() && ctx.isNoKnowledge() && mentionsInternals(generated.get())) {
                log.info("generated reply leaks internal vocabulary, replaced by fallback. key={}", ctx.getConversationKey());
                generated = Optional.empty();
            }
            body = generated.map(this::trimToLimit).orElse(lang.fallbackText());
            source = generated.isPresent() ? Reply.Source.GENERATED : Reply.Source.FALLBACK;
        }

        Optional<String> greeting = greetingFor(ctx);
        String text = greeting.map(g -> g + "\n" + body).orElse(body);
        return new Reply(text, source, lang, greeting.isPresent());
    }

    /**
     * 网页端流式聊天：不走状态机，不打招呼；出错/为空时吐一条兜底话术。
     */
    public Flux<String> stream(ConversationContext ctx) {
        ReplyLanguage lang = languageDetector.detect(ctx.getUtterance(), ctx.getLanguageHint());
        if (ctx.isNoKnowledge() && props.getNoKnowledgeMode() == DispatchProperties.NoKnowledgeMode.CANNED) {
            return Flux.just(lang.fallbackText());
        }
        GenerationRequest req = GenerationRequest.builder()
                .systemInstruction(promptComposer.composeStateless(ctx, lang))
                .history(ctx.getHistory())
                .userText(ctx.getUtterance())
                .build();
        return Flux.defer(() -> generationClient.stream(req))
                .filter(s -> s != null && !s.isEmpty())
                .timeout(collaboratorProps.timeoutOf(Collaborator.GENERATION))
                .switchIfEmpty(Flux.just(lang.fallbackText()))
                .onErrorResume(e -> {
                    log.warn("stream generation failed key={}, err={}", ctx.getConversationKey(), e.toString());
                    return Flux.just(lang.fallbackText());
                });
    }

    private Optional<String> generate(ConversationContext ctx, RequiredAction action, ReplyLanguage lang) {
        GenerationRequest req = GenerationRequest.builder()
                .systemInstruction(promptComposer.compose(ctx, action, lang))
                .history(ctx.getHistory())
                .userText(ctx.getUtterance())
                .build();
        try {
            String out = guard.call(Collaborator.GENERATION, () -> generationClient.complete(req));
            if (out == null || out.isBlank()) {
                log.warn("generation returned empty, key={}", ctx.getConversationKey());
                return Optional.empty();
            }
            return Optional.of(out.trim());
        } catch (CollaboratorException e) {
            log.warn("generation failed (timeout={}), fallback. key={}, err={}",
                    e.isTimeout(), ctx.getConversationKey(), e.getMessage());
            return Optional.empty();
        }
    }

    /** 只在这个会话从没成功发出过回复时打招呼 */
    private Optional<String> greetingFor(ConversationContext ctx) {
        if (!props.isGreetingEnabled()) return Optional.empty();
        Optional<String> name = TextSanitizer.cleanDisplayName(ctx.getSenderName());
        if (name.isEmpty()) return Optional.empty();
        if (eventStore.hasDeliveredReply(ctx.getConversationKey())) return Optional.empty();
        return Optional.of(String.format(props.getGreetingTemplate(), name.get()));
    }

    boolean mentionsInternals(String text) {
        List<String> vocab = props.getInternalVocabulary();
        if (vocab == null || vocab.isEmpty()) return false;
        String alt = vocab.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> Pattern.quote(v.trim().toLowerCase(Locale.ROOT)))
                .collect(Collectors.joining("|"));
        if (alt.isEmpty()) return false;
        return Pattern.compile("(?<![\\p{L}])(?:" + alt + ")(?![\\p{L}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE).matcher(text).find();
    }

    /** 超长回复在句子/词边界截断 */
    String trimToLimit(String text) {
        int max = props.getMaxReplyChars();
        if (max <= 0 || text.length() <= max) return text;
        // 多取一个字符，正好在上限处结束的句子也算
        String window = text.substring(0, max + 1);
        int cut = -1;
        for (String end : new String[]{". ", "! ", "? ", "।", "\n"}) {
            int i = window.lastIndexOf(end);
            if (i >= 0 && i < max) cut = Math.max(cut, i);
        }
        if (cut >= max / 2) {
            return text.substring(0, cut + 1).trim();
        }
        int space = window.lastIndexOf(' ');
        if (space >= max / 2 && space <= max) return text.substring(0, space).trim();
        int end = max;
        if (Character.isHighSurrogate(text.charAt(end - 1))) end--;
        return text.substring(0, end).trim();
    }
}
