package com.jz.chatflow.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.jz.chatflow.domain.dto.ChannelProfile;
import com.jz.chatflow.domain.entity.ChannelBinding;
import com.jz.chatflow.mapper.ChannelBindingMapper;
import com.jz.chatflow.service.ChannelDirectory;
import com.jz.chatflow.utils.ConversationKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

@Slf4j
@Service
public class ChannelDirectoryImpl
        extends ServiceImpl<ChannelBindingMapper, ChannelBinding>
        implements ChannelDirectory {

    /** 渠道配置缓存名 */
    public static final String PROFILES = "channelProfiles";

    /** 按号码缓存；没配好凭证的不缓存，运营补上配置后下一条消息就能生效 */
    @Override
    @Cacheable(cacheNames = PROFILES, key = "#businessNumber", unless = "!#result.hasCredentials()")
    public ChannelProfile profileOf(String businessNumber) {
        String norm = ConversationKeys.normalize(businessNumber);
        List<ChannelBinding> rows = loadBindings(norm);
        if (rows.isEmpty()) {
            log.warn("no channel binding for business number {}", norm);
            return ChannelProfile.empty(norm);
        }
        Set<String> scope = new LinkedHashSet<>();
        for (ChannelBinding b : rows) {
            if (b.getFileId() != null && !b.getFileId().isBlank()) scope.add(b.getFileId());
        }
        // 配置字段取第一条非空的
        return ChannelProfile.builder()
                .businessNumber(norm)
                .knowledgeScope(scope)
                .systemPrompt(firstNonBlank(rows.stream().map(ChannelBinding::getSystemPrompt).toList()))
                .intent(firstNonBlank(rows.stream().map(ChannelBinding::getIntent).toList()))
                .authToken(firstNonBlank(rows.stream().map(ChannelBinding::getAuthToken).toList()))
                .origin(firstNonBlank(rows.stream().map(ChannelBinding::getOrigin).toList()))
                .build();
    }

    /** 库里号码可能带 + 也可能不带 */
    protected List<ChannelBinding> loadBindings(String normalizedNumber) {
        return this.lambdaQuery()
                .in(ChannelBinding::getPhoneNumber, List.of(normalizedNumber, "+" + normalizedNumber))
                .orderByAsc(ChannelBinding::getId)
                .list();
    }

    private static String firstNonBlank(List<String> values) {
        return values.stream()
                .filter(Objects::nonNull)
                .filter(s -> !s.isBlank())
                .findFirst()
                .orElse(null);
    }
}
