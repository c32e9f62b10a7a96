package com.jz.chatflow.config;

import com.jz.chatflow.chat.flow.FlowTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class ConversationFlowConfig {

    /** 启动时编译一次；话题引用了未声明的字段直接启动失败 */
    @Bean
    public FlowTable flowTable(ConversationFlowProperties props) {
        FlowTable table = FlowTable.from(props);
        log.info("flow table loaded: topics={}, fields={}, reset={}, reject={}",
                table.getTopics().size(), table.getFields().keySet(),
                table.getResetLexicon().words(), table.getRejectLexicon().words());
        return table;
    }
}
