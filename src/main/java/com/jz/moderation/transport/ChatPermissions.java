package com.jz.moderation.transport;

/**
 * 用户在群内的发言权限。禁言 = {@link #READ_ONLY}，解除禁言 = {@link #FULL}。
 */
public record ChatPermissions(boolean canSendMessages, boolean canSendMedia, boolean canAddLinks) {

    public static final ChatPermissions READ_ONLY = new ChatPermissions(false, false, false);
    public static final ChatPermissions FULL = new ChatPermissions(true, true, true);
}
