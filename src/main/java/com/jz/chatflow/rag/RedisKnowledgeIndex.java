package com.jz.chatflow.rag;

import com.jz.chatflow.config.RetrievalProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.search.Document;
import redis.clients.jedis.search.Query;
import redis.clients.jedis.search.SearchResult;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * RediSearch KNN 检索（入库侧已经算好向量，这里只查）。
 * 索引结构：content(TEXT) / embedding(VECTOR, COSINE) / file_id(TAG) / source_id。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisKnowledgeIndex implements KnowledgeIndex {

    private static final String SCORE_ALIAS = "vector_score";

    private final JedisPooled jedis;
    private final RetrievalProperties props;

    @Override
    public List<RetrievalMatch> query(float[] vector, Set<String> scope, int k) {
        if (vector == null || vector.length == 0 || scope == null || scope.isEmpty() || k <= 0) {
            return List.of();
        }
        String tags = scope.stream().map(RedisKnowledgeIndex::escapeTag).collect(Collectors.joining("|"));
        String expr = "(@" + props.getScopeField() + ":{" + tags + "})=>[KNN $K @"
                + props.getVectorField() + " $BLOB AS " + SCORE_ALIAS + "]";

        Query q = new Query(expr)
                .addParam("K", k)
                .addParam("BLOB", toBytes(vector))
                .returnFields(props.getContentField(), props.getSourceField(), SCORE_ALIAS)
                .setSortBy(SCORE_ALIAS, true)
                .limit(0, k)
                .dialect(2);

        SearchResult res = jedis.ftSearch(props.getIndexName(), q);
        List<RetrievalMatch> out = new ArrayList<>();
        for (Document d : res.getDocuments()) {
            String text = d.getString(props.getContentField());
            if (text == null || text.isBlank()) continue;
            // COSINE 距离 → 相似度
            double distance = parseDouble(d.getString(SCORE_ALIAS));
            out.add(new RetrievalMatch(text, 1.0 - distance, d.getString(props.getSourceField())));
        }
        log.debug("knn done index={}, scope={}, hits={}", props.getIndexName(), scope.size(), out.size());
        return out;
    }

    static byte[] toBytes(float[] v) {
        ByteBuffer buf = ByteBuffer.allocate(v.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float f : v) buf.putFloat(f);
        return buf.array();
    }

    /** TAG 查询里除字母数字外都要转义 */
    static String escapeTag(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (char c : s.toCharArray()) {
            if (!Character.isLetterOrDigit(c) && c != '_') sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }

    private static double parseDouble(String s) {
        if (s == null) return 1.0;
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return 1.0;
        }
    }
}
