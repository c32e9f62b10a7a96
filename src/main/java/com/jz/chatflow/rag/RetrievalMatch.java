package com.jz.chatflow.rag;

import lombok.Value;

@Value
public class RetrievalMatch {
    String chunkText;
    /** 相似度，越大越相关 */
    double score;
    String sourceId;
}
