package com.jz.chatflow.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.chatflow.domain.entity.ChannelBinding;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface ChannelBindingMapper extends BaseMapper<ChannelBinding> {
}
