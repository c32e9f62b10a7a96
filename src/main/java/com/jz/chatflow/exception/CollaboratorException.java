package com.jz.chatflow.exception;

import com.jz.chatflow.client.Collaborator;

/**
 * 外部协作方（转写/向量/生成/发送/检索）调用失败或超时。
 */
public class CollaboratorException extends ChatflowException {

    private final Collaborator collaborator;
    private final boolean timeout;

    public CollaboratorException(Collaborator collaborator, String message, Throwable cause) {
        this(collaborator, message, cause, false);
    }

    public CollaboratorException(Collaborator collaborator, String message, Throwable cause, boolean timeout) {
        super("[" + collaborator + "] " + message, cause);
        this.collaborator = collaborator;
        this.timeout = timeout;
    }

    public Collaborator getCollaborator() {
        return collaborator;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
