package com.boardhub.gameservice.platform.transport;

import com.boardhub.gameservice.serializer.event.Attachment;
import com.boardhub.gameservice.serializer.event.InboundEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 发往频道的消息。authorId 为 null 表示系统（机器人）消息。
 */
public record OutboundMessage(String messageId,
                              String authorId,
                              String text,
                              List<Attachment> attachments,
                              String replyTo) {

    public OutboundMessage {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public static OutboundMessage system(String text) {
        return new OutboundMessage(newId(), null, text, List.of(), null);
    }

    /** 原样回显入站消息（沿用原消息 id，便于之后撤回） */
    public static OutboundMessage echo(InboundEvent event) {
        return new OutboundMessage(event.messageId(), event.authorId(), event.text(), event.attachments(), event.replyTo());
    }

    /** 代作者重新发出一条已被撤回的消息 */
    public static OutboundMessage repost(InboundEvent event) {
        return new OutboundMessage(newId(), event.authorId(), event.text(), event.attachments(), event.replyTo());
    }

    public OutboundMessage withAttachment(Attachment attachment) {
        List<Attachment> all = new ArrayList<>(attachments);
        all.add(attachment);
        return new OutboundMessage(messageId, authorId, text, all, replyTo);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
