package com.jz.chatflow.testutil;

import com.jz.chatflow.domain.dto.ChannelProfile;
import com.jz.chatflow.service.ChannelDirectory;
import com.jz.chatflow.utils.ConversationKeys;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

public class FakeChannelDirectory implements ChannelDirectory {

    private final Map<String, ChannelProfile> profiles = new HashMap<>();

    public FakeChannelDirectory bind(String businessNumber, Set<String> fileIds, String systemPrompt) {
        String norm = ConversationKeys.normalize(businessNumber);
        profiles.put(norm, ChannelProfile.builder()
                .businessNumber(norm)
                .knowledgeScope(fileIds)
                .systemPrompt(systemPrompt)
                .authToken("token-" + norm)
                .origin("https://shop.example")
                .build());
        return this;
    }

    public FakeChannelDirectory bindWithoutCredentials(String businessNumber, Set<String> fileIds) {
        String norm = ConversationKeys.normalize(businessNumber);
        profiles.put(norm, ChannelProfile.builder()
                .businessNumber(norm)
                .knowledgeScope(fileIds)
                .build());
        return this;
    }

    @Override
    public ChannelProfile profileOf(String businessNumber) {
        String norm = ConversationKeys.normalize(businessNumber);
        return profiles.getOrDefault(norm, ChannelProfile.empty(norm));
    }
}
