package com.jz.chatflow.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.chatflow.domain.entity.ChatMessage;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;


@Mapper
public interface ChatMessageMapper extends BaseMapper<ChatMessage> {

    /** 最近 N 条（按 seq 最新在前），排除当前这条入站事件 */
    @Select("""
        SELECT * FROM chat_message
        WHERE conversation_key = #{conversationKey}
          AND message_id <> #{excludeMessageId}
          AND text IS NOT NULL AND text <> ''
        ORDER BY seq DESC, id DESC
        LIMIT #{limit}
    """)
    List<ChatMessage> selectRecentExcluding(@Param("conversationKey") String conversationKey,
                                            @Param("excludeMessageId") String excludeMessageId,
                                            @Param("limit") int limit);

    /** 语音转写文本只补写一次 */
    @Update("""
        UPDATE chat_message SET text = #{text}
        WHERE message_id = #{messageId}
          AND (text IS NULL OR text = '')
    """)
    int fillTextOnce(@Param("messageId") String messageId, @Param("text") String text);
}
