package com.jz.moderation.service;

import com.jz.moderation.domain.entity.ModAction;

import java.util.List;

/**
 * 审计日志：按群保存最近 N 条处置记录，并转发到群配置的审计频道。
 */
public interface AuditLogService {

    /**
     * 记录一条处置。转发失败只打日志。
     *
     * @return 是否已持久化
     */
    boolean record(ModAction action);

    /**
     * 最近的处置记录，最新在前。
     *
     * @param userId 非空时只返回针对该用户的记录
     */
    List<ModAction> recent(long chatId, int limit, Long userId);
}
