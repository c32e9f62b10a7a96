package com.jz.chatflow.mapper;

import org.apache.ibatis.annotations.Select;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ChatMessageMapperTest {

    @Test
    void shouldOrderHistoryBySequenceNotWallClock() throws Exception {
        Select select = ChatMessageMapper.class
                .getMethod("selectRecentExcluding", String.class, String.class, int.class)
                .getAnnotation(Select.class);

        String sql = String.join(" ", select.value()).replaceAll("\\s+", " ");

        // 多实例时钟不一致，created_at 不能决定先后
        assertThat(sql).contains("ORDER BY seq DESC, id DESC");
        assertThat(sql).doesNotContain("created_at");
    }
}
