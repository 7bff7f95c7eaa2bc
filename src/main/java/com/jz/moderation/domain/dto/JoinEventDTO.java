package com.jz.moderation.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** 入站入群事件 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JoinEventDTO {
    private long chatId;
    private long userId;
    private String displayName;
    private String chatTitle;
    private boolean bot;
}
