package com.boardhub.gameservice.serializer.event;

import java.time.Instant;

/**
 * 会话忙时被拦截的事件。
 * 先在队列里占位（保证到达顺序），附件读取完成后由 {@link #fill} 填充；
 * 所有字段只在所属 SessionGate 的监视器内读写。
 */
public final class QueuedEvent {

    /** 会话内到达序号，只用于排序 */
    private final long sequence;
    private final Instant arrivedAt;
    private final InboundEvent original;
    private InboundEvent captured;

    public QueuedEvent(long sequence, InboundEvent original, Instant arrivedAt) {
        this.sequence = sequence;
        this.original = original;
        this.arrivedAt = arrivedAt;
    }

    public void fill(InboundEvent capturedEvent) {
        this.captured = capturedEvent;
    }

    public boolean isReady() {
        return captured != null;
    }

    public long sequence() {
        return sequence;
    }

    public Instant arrivedAt() {
        return arrivedAt;
    }

    public InboundEvent original() {
        return original;
    }

    public InboundEvent captured() {
        return captured;
    }

    @Override
    public String toString() {
        return "QueuedEvent{seq=" + sequence + ", messageId=" + original.messageId()
                + ", author=" + original.authorId() + ", ready=" + isReady() + '}';
    }
}
