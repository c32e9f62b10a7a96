package com.jz.chatflow.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.jz.chatflow.domain.entity.ConversationSession;
import com.jz.chatflow.mapper.ConversationSessionMapper;
import com.jz.chatflow.service.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Optional;

@Slf4j
@Service
public class SessionStoreImpl extends ServiceImpl<ConversationSessionMapper, ConversationSession>
        implements SessionStore {

    @Override
    public Optional<ConversationSession> find(String conversationKey) {
        ConversationSession s = this.lambdaQuery()
                .eq(ConversationSession::getConversationKey, conversationKey)
                .last("limit 1")
                .one();
        if (s == null) return Optional.empty();
        // JSON 列可能是 null（老数据），补成空集合
        if (s.getSlots() == null) s.setSlots(new LinkedHashMap<>());
        if (s.getPendingFields() == null) s.setPendingFields(new ArrayList<>());
        return Optional.of(s);
    }

    @Override
    public void upsert(ConversationSession session) {
        int n = baseMapper.upsert(session);
        log.debug("session upserted key={}, stage={}, pending={}, affected={}",
                session.getConversationKey(), session.getStage(), session.getPendingFields(), n);
    }
}
