package com.jz.chatflow.exception;

/**
 * 渠道配置缺失（例如业务号码没有绑定发送凭证）。
 * 只中断当前会话的处理，不自动重试，需要运维补配置。
 */
public class ConfigurationMissingException extends ChatflowException {

    private final String businessNumber;

    public ConfigurationMissingException(String businessNumber, String what) {
        super(what + " missing for business number " + businessNumber);
        this.businessNumber = businessNumber;
    }

    public String getBusinessNumber() {
        return businessNumber;
    }
}
