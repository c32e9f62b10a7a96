package com.jz.chatflow.domain.entity;

import java.util.List;
import java.util.Map;

public enum SessionStage {
    INIT,
    COLLECTING,
    CONFIRMING,
    STOPPED;

    /**
     * 阶段只由 (slots, pendingFields) 决定，外加 STOPPED 这个终止覆盖。
     */
    public static SessionStage derive(boolean stopped, Map<String, String> slots, List<String> pendingFields) {
        if (stopped) return STOPPED;
        if (pendingFields != null && !pendingFields.isEmpty()) return COLLECTING;
        if (slots != null && !slots.isEmpty()) return CONFIRMING;
        return INIT;
    }
}
