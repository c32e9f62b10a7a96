package com.jz.chatflow.rag;

import com.jz.chatflow.client.CollaboratorGuard;
import com.jz.chatflow.config.CollaboratorProperties;
import com.jz.chatflow.config.RetrievalProperties;
import com.jz.chatflow.domain.dto.ChatTurn;
import com.jz.chatflow.testutil.Events;
import com.jz.chatflow.testutil.FakeChannelDirectory;
import com.jz.chatflow.testutil.FakeKnowledge;
import com.jz.chatflow.testutil.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RetrievalAssemblerTest {

    private InMemoryEventStore events;
    private FakeChannelDirectory channels;
    private FakeKnowledge knowledge;
    private RetrievalProperties props;
    private RetrievalAssembler assembler;

    @BeforeEach
    void setUp() {
        events = new InMemoryEventStore();
        channels = new FakeChannelDirectory().bind(Events.BUSINESS, Set.of("file-a", "file-b"), null);
        knowledge = new FakeKnowledge();
        props = new RetrievalProperties();
        CollaboratorGuard guard = new CollaboratorGuard(new SimpleAsyncTaskExecutor("t-"), new CollaboratorProperties());
        assembler = new RetrievalAssembler(channels, events, knowledge, knowledge, guard, props);
    }

    @Test
    void shouldRankByScoreAndJoinWithBlankLine() {
        knowledge.withMatch("low", 0.2, "file-a")
                .withMatch("high", 0.9, "file-b")
                .withMatch("mid", 0.5, "file-a");

        ConversationContext ctx = assembler.assemble("timing?", Events.KEY);

        assertThat(ctx.getMatches()).extracting(RetrievalMatch::getChunkText).containsExactly("high", "mid", "low");
        assertThat(ctx.getContextBlock()).isEqualTo("high\n\nmid\n\nlow");
        assertThat(ctx.isNoKnowledge()).isFalse();
        assertThat(knowledge.lastScope).containsExactlyInAnyOrder("file-a", "file-b");
    }

    @Test
    void shouldKeepIndexOrderForEqualScoresAndCutAtTopK() {
        List<RetrievalMatch> raw = List.of(
                new RetrievalMatch("a", 0.7, "f"),
                new RetrievalMatch("b", 0.7, "f"),
                new RetrievalMatch("c", 0.9, "f"),
                new RetrievalMatch("d", 0.7, "f"));

        List<RetrievalMatch> ranked = RetrievalAssembler.rank(raw, 3, 0.0);

        assertThat(ranked).extracting(RetrievalMatch::getChunkText).containsExactly("c", "a", "b");
    }

    @Test
    void shouldDropMatchesBelowMinScore() {
        List<RetrievalMatch> ranked = RetrievalAssembler.rank(List.of(
                new RetrievalMatch("keep", 0.6, "f"),
                new RetrievalMatch("drop", 0.1, "f")), 5, 0.3);

        assertThat(ranked).extracting(RetrievalMatch::getChunkText).containsExactly("keep");
    }

    @Test
    void shouldReportNoKnowledgeWhenScopeIsEmpty() {
        channels.bind(Events.BUSINESS, Set.of(), null);
        knowledge.withMatch("never returned", 0.9, "x");

        ConversationContext ctx = assembler.assemble("timing?", Events.KEY);

        assertThat(ctx.isNoKnowledge()).isTrue();
        assertThat(ctx.getMatches()).isEmpty();
        assertThat(knowledge.queries).isZero();
    }

    @Test
    void shouldDegradeToNoKnowledgeWhenEmbeddingFails() {
        knowledge.withMatch("unreachable", 0.9, "file-a");
        knowledge.embeddingFails(true);

        ConversationContext ctx = assembler.assemble("timing?", Events.KEY);

        assertThat(ctx.isNoKnowledge()).isTrue();
        assertThat(ctx.getContextBlock()).isEmpty();
    }

    @Test
    void shouldLoadHistoryOldestFirstExcludingCurrentEvent() {
        props.setHistorySize(2);
        events.recordInbound(Events.text("h1", "first"));
        events.recordOutbound(Events.KEY, "h1", "reply one");
        events.recordInbound(Events.text("h2", "second"));
        events.recordInbound(Events.text("current", "third"));

        ConversationContext ctx = assembler.assemble("third", Events.KEY, "current");

        assertThat(ctx.getHistory()).extracting(ChatTurn::getText).containsExactly("reply one", "second");
        assertThat(ctx.getHistory().get(0).getRole()).isEqualTo(ChatTurn.Role.ASSISTANT);
    }

    @Test
    void shouldUseOnlyCallerHistoryForWebSessions() {
        props.setHistorySize(2);
        events.recordInbound(Events.text("h1", "whatsapp private question"));
        events.recordOutbound(Events.KEY, "h1", "whatsapp private answer");
        knowledge.withMatch("open 11am", 0.9, "file-a");

        ConversationContext ctx = assembler.assembleWithHistory("price?", Events.BUSINESS, "web:browser1:" + Events.BUSINESS,
                List.of(ChatTurn.user("hi"), ChatTurn.user("timing?"), ChatTurn.assistant("11am to 10pm.")));

        assertThat(ctx.getConversationKey()).isEqualTo("web:browser1:" + Events.BUSINESS);
        assertThat(ctx.getHistory()).extracting(ChatTurn::getText).containsExactly("timing?", "11am to 10pm.");
        assertThat(ctx.getContextBlock()).isEqualTo("open 11am");
        assertThat(knowledge.lastScope).containsExactlyInAnyOrder("file-a", "file-b");
    }
}
