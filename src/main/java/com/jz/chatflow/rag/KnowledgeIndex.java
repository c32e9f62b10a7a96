package com.jz.chatflow.rag;

import java.util.List;
import java.util.Set;

public interface KnowledgeIndex {
    /**
     * 在 scope（知识文件 id 集合）内做向量近邻检索，最多返回 k 条，相似度降序。
     */
    List<RetrievalMatch> query(float[] vector, Set<String> scope, int k);
}
