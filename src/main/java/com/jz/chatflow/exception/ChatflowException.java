package com.jz.chatflow.exception;

/**
 * 编排链路内所有业务异常的基类（非受检）。
 * 统一继承它，方便在 Orchestrator 边界和 ControllerAdvice 里集中处理。
 */
public class ChatflowException extends RuntimeException {

    public ChatflowException(String message) {
        super(message);
    }

    public ChatflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
