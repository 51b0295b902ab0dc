package com.boardhub.gameservice.serializer.event;

import java.time.Instant;
import java.util.List;

/**
 * 频道入站事件（一条聊天消息）。
 * channelId 即会话 id；replyTo 为被回复消息的 id，可空。
 */
public record InboundEvent(String messageId,
                           String channelId,
                           String authorId,
                           String text,
                           List<Attachment> attachments,
                           String replyTo,
                           Instant receivedAt) {

    public InboundEvent {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        text = text == null ? "" : text;
    }

    /** 替换附件（捕获后使用） */
    public InboundEvent withAttachments(List<Attachment> captured) {
        return new InboundEvent(messageId, channelId, authorId, text, captured, replyTo, receivedAt);
    }
}
