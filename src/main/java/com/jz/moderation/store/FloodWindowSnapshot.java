package com.jz.moderation.store;

import java.util.List;

/**
 * @param existedBefore 记录之前该用户的窗口 key 是否已存在
 * @param inWindow      记录之后落在 [windowStart, now] 内的条目
 */
public record FloodWindowSnapshot(boolean existedBefore, List<FloodEntry> inWindow) {
}
