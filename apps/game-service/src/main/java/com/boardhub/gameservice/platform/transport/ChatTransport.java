package com.boardhub.gameservice.platform.transport;

import com.boardhub.gameservice.serializer.event.Attachment;

import java.io.IOException;

/**
 * 聊天频道传输层（平台通用）。
 * 只保证最终送达，不保证顺序，也不提供互斥；会话内的顺序由 CommandSerializer 保证。
 */
public interface ChatTransport {

    /** 向频道发送一条消息 */
    void send(String channelId, OutboundMessage message);

    /** 仅对某个用户可见的提示 */
    void notifyUser(String channelId, String userId, String text);

    /** 撤回频道中的一条消息 */
    void delete(String channelId, String messageId);

    /**
     * 读取附件的完整字节。
     * @throws IOException 读取失败
     */
    byte[] readAttachment(Attachment attachment) throws IOException;
}
