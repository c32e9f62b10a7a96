package com.jz.chatflow.chat.orchestrator;

/** 一次入站事件处理的结果 */
public enum Outcome {
    REPLIED,
    /** 状态机要求静默（已 STOPPED） */
    SILENCED,
    /** 非用户消息（回执/回显），只落库 */
    IGNORED,
    EMPTY,
    DUPLICATE,
    TRANSCRIPTION_FAILED,
    /** 状态已保存，回复挂在会话上等重发 */
    DELIVERY_FAILED,
    CONFIGURATION_MISSING,
    FAILED
}
