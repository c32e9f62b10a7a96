package com.jz.chatflow.service;

import com.jz.chatflow.domain.dto.ChannelProfile;

public interface ChannelDirectory {
    /** 业务号码的渠道配置；没有任何绑定时返回空配置（不抛异常） */
    ChannelProfile profileOf(String businessNumber);
}
