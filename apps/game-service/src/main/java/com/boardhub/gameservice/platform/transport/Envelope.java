package com.boardhub.gameservice.platform.transport;

import java.time.Instant;
import java.util.Objects;

/**
 * 传输消息外壳（所有游戏共用）
 * - 强类型泛型载荷：Envelope<T>
 * - 最少字段：kind / channelId / payload / ts / seq
 *
 * 用法示例：
 *   Envelope<OutboundMessage> msg = Envelope.message(channelId, outbound);
 *   Envelope<String>          del = Envelope.delete(channelId, messageId);
 */
public record Envelope<T>(Kind kind, String channelId, T payload, long ts, long seq) {

    /** MESSAGE=频道消息，DELETE=撤回（payload 为消息 id），NOTICE=仅本人可见的提示 */
    public enum Kind { MESSAGE, DELETE, NOTICE }

    public Envelope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(channelId, "channelId");
    }

    /** 自由构造（若不关心 seq，传 0） */
    public static <T> Envelope<T> of(Kind kind, String channelId, T payload, long seq) {
        return new Envelope<>(kind, channelId, payload, Instant.now().toEpochMilli(), seq);
    }

    public static <T> Envelope<T> message(String channelId, T payload) {
        return of(Kind.MESSAGE, channelId, payload, 0);
    }

    public static Envelope<String> delete(String channelId, String messageId) {
        return of(Kind.DELETE, channelId, messageId, 0);
    }

    public static Envelope<String> notice(String channelId, String text) {
        return of(Kind.NOTICE, channelId, text, 0);
    }
}
