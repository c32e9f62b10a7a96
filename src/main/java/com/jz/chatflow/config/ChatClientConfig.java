package com.jz.chatflow.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChatClientConfig {

    // 无记忆：历史由 EventStore 取出后自己拼，不挂任何 Advisor
    @Bean
    public ChatClient statelessChatClient(ChatModel chatModel) {
        return ChatClient.builder(chatModel).build();
    }
}
