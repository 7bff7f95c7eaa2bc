package com.jz.moderation.transport;

import com.jz.moderation.security.IdMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 未接入真实平台客户端时的兜底实现：只打日志，消息 id 自增。
 */
@Slf4j
@RequiredArgsConstructor
public class LoggingChatTransport implements ChatTransport {

    private final IdMasker masker;
    private final AtomicLong messageIds = new AtomicLong(1);

    @Override
    public long sendMessage(long targetId, OutboundMessage message) {
        long id = messageIds.getAndIncrement();
        log.info("[Transport] send target={}, messageId={}, buttons={}, len={}",
                masker.chat(targetId), id, message.buttons().size(), message.text().length());
        return id;
    }

    @Override
    public void deleteMessage(long chatId, long messageId) {
        log.info("[Transport] delete chat={}, messageId={}", masker.chat(chatId), messageId);
    }

    @Override
    public void restrictUser(long chatId, long userId, ChatPermissions permissions, Instant until) {
        log.info("[Transport] restrict chat={}, user={}, perms={}, until={}",
                masker.chat(chatId), masker.user(userId), permissions, until);
    }

    @Override
    public void banUser(long chatId, long userId) {
        log.info("[Transport] ban chat={}, user={}", masker.chat(chatId), masker.user(userId));
    }

    @Override
    public void unbanUser(long chatId, long userId) {
        log.info("[Transport] unban chat={}, user={}", masker.chat(chatId), masker.user(userId));
    }

    @Override
    public MemberRole getMemberStatus(long chatId, long userId) {
        return MemberRole.MEMBER;
    }

    @Override
    public int getMemberCount(long chatId) {
        return 0;
    }
}
