package com.boardhub.gameservice.platform.transport;

import com.boardhub.gameservice.serializer.event.Attachment;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.util.Base64;

/**
 * 基于 STOMP 的频道传输实现。
 * - 频道广播：/topic/channel.{channelId}
 * - 个人提示：/user/{userId}/queue/board
 * - 附件：URL 通过 RestClient 下载，data URI / base64 直接解码
 */
@Slf4j
@Component
public class StompChatTransport implements ChatTransport {

    private static final String CHANNEL_TOPIC = "/topic/channel.";
    private static final String USER_QUEUE = "/queue/board";

    private final SimpMessagingTemplate messaging;
    private final RestClient restClient;

    public StompChatTransport(SimpMessagingTemplate messaging, RestClient.Builder restClientBuilder) {
        this.messaging = messaging;
        this.restClient = restClientBuilder.build();
    }

    @Override
    public void send(String channelId, OutboundMessage message) {
        messaging.convertAndSend(CHANNEL_TOPIC + channelId, Envelope.message(channelId, message));
    }

    @Override
    public void notifyUser(String channelId, String userId, String text) {
        if (StringUtils.isBlank(userId)) {
            log.warn("notifyUser without user: channel={} text={}", channelId, text);
            return;
        }
        messaging.convertAndSendToUser(userId, USER_QUEUE, Envelope.notice(channelId, text));
    }

    @Override
    public void delete(String channelId, String messageId) {
        messaging.convertAndSend(CHANNEL_TOPIC + channelId, Envelope.delete(channelId, messageId));
    }

    @Override
    public byte[] readAttachment(Attachment attachment) throws IOException {
        if (attachment.isMaterialized()) {
            return attachment.content();
        }
        String source = StringUtils.trimToEmpty(attachment.source());
        if (source.isEmpty()) {
            return new byte[0];
        }
        if (StringUtils.startsWithIgnoreCase(source, "http://") || StringUtils.startsWithIgnoreCase(source, "https://")) {
            try {
                byte[] body = restClient.get().uri(source).retrieve().body(byte[].class);
                return body == null ? new byte[0] : body;
            } catch (RestClientException e) {
                throw new IOException("download failed: " + source, e);
            }
        }
        // data:[<mediatype>][;base64],<data> 或裸 base64
        String data = source.startsWith("data:") ? StringUtils.substringAfter(source, ",") : source;
        try {
            return Base64.getDecoder().decode(data);
        } catch (IllegalArgumentException e) {
            throw new IOException("invalid inline attachment " + attachment.fileName(), e);
        }
    }
}
