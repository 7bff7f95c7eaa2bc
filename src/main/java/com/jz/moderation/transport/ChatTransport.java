package com.jz.moderation.transport;

import java.time.Instant;

/**
 * 聊天平台客户端边界。所有方法失败时抛 {@link TransportException}，调用方自行决定是否吞掉。
 */
public interface ChatTransport {

    /** @return 平台分配的消息 id */
    long sendMessage(long targetId, OutboundMessage message);

    void deleteMessage(long chatId, long messageId);

    /** until 为 null 表示永久 */
    void restrictUser(long chatId, long userId, ChatPermissions permissions, Instant until);

    void banUser(long chatId, long userId);

    void unbanUser(long chatId, long userId);

    MemberRole getMemberStatus(long chatId, long userId);

    int getMemberCount(long chatId);
}
