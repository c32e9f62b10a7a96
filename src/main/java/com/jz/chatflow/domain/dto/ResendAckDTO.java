package com.jz.chatflow.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResendAckDTO {
    private String conversationKey;
    private String status;
}
