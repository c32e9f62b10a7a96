package com.jz.chatflow.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.chatflow.domain.entity.ConversationSession;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface ConversationSessionMapper extends BaseMapper<ConversationSession> {

    /** conversation_key 唯一；存在则整体覆盖状态字段 */
    @Insert("""
        INSERT INTO conversation_session
            (conversation_key, stage, slots, pending_fields, last_user_text,
             pending_reply, pending_reply_event_id, created_at, updated_at)
        VALUES
            (#{s.conversationKey}, #{s.stage},
             #{s.slots, typeHandler=com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler},
             #{s.pendingFields, typeHandler=com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler},
             #{s.lastUserText}, #{s.pendingReply}, #{s.pendingReplyEventId}, NOW(3), NOW(3))
        ON DUPLICATE KEY UPDATE
            stage = VALUES(stage),
            slots = VALUES(slots),
            pending_fields = VALUES(pending_fields),
            last_user_text = VALUES(last_user_text),
            pending_reply = VALUES(pending_reply),
            pending_reply_event_id = VALUES(pending_reply_event_id),
            updated_at = NOW(3)
    """)
    int upsert(@Param("s") ConversationSession session);
}
