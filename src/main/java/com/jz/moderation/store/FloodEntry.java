package com.jz.moderation.store;

import java.time.Instant;

/** 刷屏窗口中的一条记录；编码为 "epochMillis:messageId" 作为 zset member */
public record FloodEntry(Instant sentAt, long messageId) {

    public String encode() {
        return sentAt.toEpochMilli() + ":" + messageId;
    }

    public static FloodEntry decode(String member) {
        int i = member.indexOf(':');
        if (i <= 0) throw new IllegalArgumentException("bad flood member: " + member);
        return new FloodEntry(
                Instant.ofEpochMilli(Long.parseLong(member.substring(0, i))),
                Long.parseLong(member.substring(i + 1)));
    }
}
