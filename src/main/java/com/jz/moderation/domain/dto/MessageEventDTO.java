package com.jz.moderation.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** 入站群消息 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageEventDTO {
    private long chatId;
    private long userId;
    private long messageId;
    private String text;
    private String chatTitle;
    private boolean bot;
    /** 平台时间戳；为空时用服务端时钟 */
    private Instant sentAt;
}
