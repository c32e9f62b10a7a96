package com.jz.chatflow.chat.dispatch;

import com.jz.chatflow.chat.language.ReplyLanguage;
import lombok.Value;

@Value
public class Reply {

    public enum Source {
        /** 固定话术（礼貌结束语等） */
        CANNED,
        GENERATED,
        /** 模型失败/超时/无资料时的兜底话术 */
        FALLBACK,
        /** 不回复 */
        NONE
    }

    String text;
    Source source;
    ReplyLanguage language;
    boolean greeted;

    public static Reply none() {
        return new Reply(null, Source.NONE, null, false);
    }

    public static Reply canned(String text) {
        return new Reply(text, Source.CANNED, null, false);
    }

    public boolean isPresent() {
        return source != Source.NONE && text != null && !text.isBlank();
    }
}
