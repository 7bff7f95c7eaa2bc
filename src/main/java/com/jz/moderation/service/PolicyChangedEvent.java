package com.jz.moderation.service;

/** 某个群的设置被写入或重置，下游缓存据此失效 */
public record PolicyChangedEvent(long chatId) {
}
