package com.boardhub.gameservice.serializer.event;

import java.util.Arrays;
import java.util.Objects;

/**
 * 消息附件。
 * source 为 URL 或 base64 内联数据；content 为已读取的完整字节（未读取时为 null）。
 */
public record Attachment(String fileName, String contentType, String source, byte[] content) {

    public static Attachment remote(String fileName, String contentType, String source) {
        return new Attachment(fileName, contentType, source, null);
    }

    public static Attachment inline(String fileName, String contentType, byte[] content) {
        return new Attachment(fileName, contentType, null, content);
    }

    public boolean isMaterialized() {
        return content != null;
    }

    /** 返回带完整字节的副本 */
    public Attachment materialized(byte[] bytes) {
        return new Attachment(fileName, contentType, source, bytes);
    }

    public int size() {
        return content == null ? 0 : content.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Attachment other)) return false;
        return Objects.equals(fileName, other.fileName)
                && Objects.equals(contentType, other.contentType)
                && Objects.equals(source, other.source)
                && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(fileName, contentType, source);
        return 31 * h + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "Attachment{fileName='" + fileName + "', contentType='" + contentType + "', size=" + size() + '}';
    }
}
