package com.boardhub.gameservice.games.board.render;

import com.boardhub.gameservice.serializer.event.Attachment;

/**
 * 渲染结果，作为附件发到频道。
 */
public record RenderedBoard(String fileName, String contentType, byte[] content) {

    public Attachment toAttachment() {
        return Attachment.inline(fileName, contentType, content);
    }
}
