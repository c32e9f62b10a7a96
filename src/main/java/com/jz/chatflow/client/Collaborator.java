package com.jz.chatflow.client;

public enum Collaborator {
    TRANSCRIPTION,
    EMBEDDING,
    KNOWLEDGE_INDEX,
    GENERATION,
    DELIVERY
}
