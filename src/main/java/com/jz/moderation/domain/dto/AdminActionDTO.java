package com.jz.moderation.domain.dto;

import lombok.Data;

/** 管理员手动处置请求 */
@Data
public class AdminActionDTO {
    private long adminId;
    private long userId;
    private String reason;
    /** 仅 mute 使用，默认 60 */
    private Integer minutes;
}
