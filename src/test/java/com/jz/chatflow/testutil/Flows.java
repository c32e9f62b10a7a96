package com.jz.chatflow.testutil;

import com.jz.chatflow.chat.flow.FieldType;
import com.jz.chatflow.chat.flow.FlowTable;
import com.jz.chatflow.config.ConversationFlowProperties;

import java.util.List;

/** 测试用的对话流配置：VR 预约（人数/日期/时间） */
public final class Flows {
    private Flows() {}

    public static ConversationFlowProperties vrBookingProps() {
        ConversationFlowProperties p = new ConversationFlowProperties();
        ConversationFlowProperties.Topic vr = new ConversationFlowProperties.Topic();
        vr.setName("vr");
        vr.setKeywords(List.of("vr", "virtual reality"));
        vr.setRequiredFields(List.of("group_size", "date", "time"));
        p.getTopics().add(vr);
        p.getFields().put("group_size", field(FieldType.NUMBER));
        p.getFields().put("date", field(FieldType.DATE));
        p.getFields().put("time", field(FieldType.TIME));
        return p;
    }

    public static FlowTable vrBooking() {
        return FlowTable.from(vrBookingProps());
    }

    public static ConversationFlowProperties.Field field(FieldType type) {
        ConversationFlowProperties.Field f = new ConversationFlowProperties.Field();
        f.setType(type);
        return f;
    }
}
