package com.jz.chatflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chatflow.retrieval")
@Data
public class RetrievalProperties {
    private int topK = 5;
    private int historySize = 12;
    private double minScore = 0.0;

    // RediSearch 索引结构（与入库侧保持一致）
    private String indexName = "chatflow-knowledge";
    private String contentField = "content";
    private String vectorField = "embedding";
    private String scopeField = "file_id";
    private String sourceField = "source_id";
}
