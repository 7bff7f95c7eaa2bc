package com.jz.moderation.transport;

import java.util.List;

/**
 * 发往平台的一条消息。buttons 非空时渲染为单选按钮（验证码选项）。
 */
public record OutboundMessage(String text, boolean html, List<String> buttons) {

    public OutboundMessage {
        buttons = buttons == null ? List.of() : List.copyOf(buttons);
    }

    public static OutboundMessage plain(String text) {
        return new OutboundMessage(text, false, List.of());
    }

    public static OutboundMessage html(String text) {
        return new OutboundMessage(text, true, List.of());
    }

    public static OutboundMessage withButtons(String text, List<String> buttons) {
        return new OutboundMessage(text, true, buttons);
    }
}
