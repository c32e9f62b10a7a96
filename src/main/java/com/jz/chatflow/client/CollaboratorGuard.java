package com.jz.chatflow.client;

import com.jz.chatflow.config.CollaboratorProperties;
import com.jz.chatflow.exception.CollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 所有外部调用都走这里：专用线程池 + 强制超时。
 * 失败/超时统一包成 CollaboratorException，由调用方决定降级方式。
 */
@Slf4j
@Component
public class CollaboratorGuard {

    private final AsyncTaskExecutor executor;
    private final CollaboratorProperties props;

    public CollaboratorGuard(@Qualifier("collaboratorExecutor") AsyncTaskExecutor executor,
                             CollaboratorProperties props) {
        this.executor = executor;
        this.props = props;
    }

    public <T> T call(Collaborator collaborator, Supplier<T> action) {
        Duration timeout = props.timeoutOf(collaborator);
        long t0 = System.currentTimeMillis();
        CompletableFuture<T> f = executor.submitCompletable(action::get);
        try {
            return f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            log.warn("{} timed out after {}ms", collaborator, timeout.toMillis());
            throw new CollaboratorException(collaborator, "timed out after " + timeout.toMillis() + "ms", e, true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof CollaboratorException ce) throw ce;
            log.warn("{} failed in {}ms: {}", collaborator, System.currentTimeMillis() - t0, cause.toString());
            throw new CollaboratorException(collaborator, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            throw new CollaboratorException(collaborator, "interrupted", e);
        }
    }

    public void run(Collaborator collaborator, Runnable action) {
        call(collaborator, () -> {
            action.run();
            return null;
        });
    }
}
