package com.jz.chatflow.controller;

import com.jz.chatflow.common.Result;
import com.jz.chatflow.exception.ConfigurationMissingException;
import com.jz.chatflow.exception.ConversationBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 控制器边界的统一异常出口，全部包成 Result。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    ResponseEntity<Result<Void>> handleBadRequest(Exception ex) {
        log.warn("bad request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Result.badRequest(ex.getMessage()));
    }

    @ExceptionHandler(ConversationBusyException.class)
    ResponseEntity<Result<Void>> handleBusy(ConversationBusyException ex) {
        log.warn("conversation busy: {}", ex.getConversationKey());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Result.of(409, "conversation is busy, retry later", null));
    }

    @ExceptionHandler(ConfigurationMissingException.class)
    ResponseEntity<Result<Void>> handleConfigMissing(ConfigurationMissingException ex) {
        log.error("configuration missing for {}", ex.getBusinessNumber());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Result.of(503, ex.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<Result<Void>> handleUnexpected(Exception ex) {
        log.error("unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.error("internal error"));
    }
}
