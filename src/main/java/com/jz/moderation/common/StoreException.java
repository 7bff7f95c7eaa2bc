package com.jz.moderation.common;

/**
 * 存储层不可用或数据损坏。读路径降级为默认值，写路径向上抛出。
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
