package com.jz.chatflow.client;

import com.jz.chatflow.config.CollaboratorProperties;
import com.jz.chatflow.exception.CollaboratorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollaboratorGuardTest {

    private CollaboratorGuard guard;

    @BeforeEach
    void setUp() {
        CollaboratorProperties props = new CollaboratorProperties();
        props.setGenerationTimeout(Duration.ofMillis(100));
        guard = new CollaboratorGuard(new SimpleAsyncTaskExecutor("guard-test-"), props);
    }

    @Test
    void shouldReturnValueWithinTimeout() {
        assertThat(guard.call(Collaborator.GENERATION, () -> "hello")).isEqualTo("hello");
    }

    @Test
    void shouldFlagTimeout() {
        assertThatThrownBy(() -> guard.call(Collaborator.GENERATION, () -> slow("late")))
                .isInstanceOfSatisfying(CollaboratorException.class, e -> {
                    assertThat(e.isTimeout()).isTrue();
                    assertThat(e.getCollaborator()).isEqualTo(Collaborator.GENERATION);
                });
    }

    @Test
    void shouldWrapFailureWithOriginalCause() {
        IllegalStateException boom = new IllegalStateException("503 from upstream");

        assertThatThrownBy(() -> guard.call(Collaborator.DELIVERY, () -> {
            throw boom;
        }))
                .isInstanceOfSatisfying(CollaboratorException.class, e -> {
                    assertThat(e.isTimeout()).isFalse();
                    assertThat(e.getCollaborator()).isEqualTo(Collaborator.DELIVERY);
                    assertThat(e.getCause()).isSameAs(boom);
                });
    }

    @Test
    void shouldRethrowCollaboratorExceptionUnchanged() {
        CollaboratorException inner = new CollaboratorException(Collaborator.DELIVERY, "status=false", null);

        assertThatThrownBy(() -> guard.run(Collaborator.DELIVERY, () -> {
            throw inner;
        })).isSameAs(inner);
    }

    private static String slow(String value) {
        try {
            Thread.sleep(2_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return value;
    }
}
