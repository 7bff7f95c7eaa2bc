package com.jz.moderation.domain.dto;

import java.util.List;

/**
 * @param count              计入本次消息后，窗口 [now - window, now] 内的消息数
 * @param offendingMessageIds 窗口内的消息 id（命中时用于批量删除）
 */
public record FloodCheck(boolean tripped, int count, List<Long> offendingMessageIds) {

    public static FloodCheck pass(int count) {
        return new FloodCheck(false, count, List.of());
    }
}
