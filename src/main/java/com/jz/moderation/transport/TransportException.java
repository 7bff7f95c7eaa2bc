package com.jz.moderation.transport;

/** 聊天平台调用失败（网络、权限不足、目标不存在等） */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
