package com.boardhub.gameservice.games.board.interfaces.ws.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 * 客户端 → 服务端：/app/board.message 发送一条频道消息（命令或普通聊天）。
 * 服务端 → 客户端：统一使用 Envelope（见 platform.transport）。
 */
public class BoardMessages {

    /**
     * 频道消息（客户端 → 服务端）
     * 字段：
     *   - channelId ：频道（即会话）id；
     *   - messageId ：客户端生成的消息 id，可空（服务端补 UUID）；
     *   - text      ：文本；
     *   - replyTo   ：被回复的消息 id，可空；
     *   - attachments：附件列表。
     */
    @Data
    public static class PostMessageCmd {
        @NotBlank(message = "channelId is required")
        private String channelId;
        private String messageId;
        @Size(max = 4000, message = "text is too long")
        private String text;
        private String replyTo;
        private List<AttachmentPayload> attachments = new ArrayList<>();
    }

    /**
     * 附件：url 与 data（base64 或 data URI）二选一。
     */
    @Data
    public static class AttachmentPayload {
        private String fileName;
        private String contentType;
        private String url;
        private String data;
    }
}
