package com.boardhub.gameservice.serializer.gate;

import com.boardhub.gameservice.platform.transport.ChatTransport;
import com.boardhub.gameservice.serializer.event.Attachment;
import com.boardhub.gameservice.serializer.event.InboundEvent;
import com.boardhub.gameservice.serializer.event.QueuedEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * CommandSerializerImpl
 * ---------------------------------------
 * 默认实现：每个会话一个 {@link SessionGate}。
 *
 * 职责：
 *  - 空闲时直接执行操作，结束后在同一线程上按到达顺序重放排队事件；
 *  - 忙时捕获事件（附件读取到完整字节）、撤回原消息、入队；
 *  - 单个重放失败只记日志，继续重放下一个。
 *
 * 不做的事：
 *  - 不解析命令，不关心游戏规则；
 *  - 没有锁超时，一个卡住的操作只会卡住它自己的会话。
 */
@Slf4j
public class CommandSerializerImpl implements CommandSerializer {

    static final String DROPPED_ATTACHMENT_NOTICE =
            "⚠️ Your attachment \"%s\" could not be captured while the game was busy and was dropped. Please send it again.";

    private final ChatTransport transport;
    // 会话 id -> 锁；会话数即频道数，不回收
    private final ConcurrentMap<String, SessionGate> gates = new ConcurrentHashMap<>();
    private volatile ReplayHandler replayHandler;

    public CommandSerializerImpl(ChatTransport transport) {
        this.transport = transport;
    }

    @Override
    public void setReplayHandler(ReplayHandler handler) {
        this.replayHandler = handler;
    }

    @Override
    public <T> Optional<T> submit(InboundEvent event, boolean replayed, Supplier<T> operation) {
        SessionGate gate = gate(event.channelId());
        if (gate.heldByCurrentThread()) {
            log.warn("Dropped event {} on session {}: lock is still held by the running operation",
                    event.messageId(), gate.sessionId());
            return Optional.empty();
        }
        if (replayed) {
            if (gate.drainingOnCurrentThread()) {
                gate.acquireForReplay();
                return runHeld(gate, operation);
            }
            log.debug("Replayed event {} outside a drain, waiting for session {}", event.messageId(), gate.sessionId());
            return lockAndRun(gate, operation);
        }
        QueuedEvent slot = gate.acquireOrReserve(event);
        if (slot != null) {
            intercept(gate, slot);
            return Optional.empty();
        }
        return runAndDrain(gate, operation);
    }

    @Override
    public <T> Optional<T> withLock(String sessionId, Supplier<T> operation) {
        SessionGate gate = gate(sessionId);
        if (gate.heldByCurrentThread()) {
            log.warn("Dropped nested operation on session {}: lock is still held by the running operation", sessionId);
            return Optional.empty();
        }
        if (gate.drainingOnCurrentThread()) {
            gate.acquireForReplay();
            return runHeld(gate, operation);
        }
        return lockAndRun(gate, operation);
    }

    @Override
    public <T> Optional<T> tryWithLock(String sessionId, Supplier<T> operation) {
        SessionGate gate = gate(sessionId);
        if (gate.heldByCurrentThread()) {
            log.warn("Dropped nested operation on session {}: lock is still held by the running operation", sessionId);
            return Optional.empty();
        }
        if (!gate.tryAcquire()) {
            log.debug("Session {} busy, skipped background operation", sessionId);
            return Optional.empty();
        }
        return runAndDrain(gate, operation);
    }

    @Override
    public boolean isBusy(String sessionId) {
        SessionGate gate = gates.get(sessionId);
        return gate != null && gate.isBusy();
    }

    @Override
    public int pendingCount(String sessionId) {
        SessionGate gate = gates.get(sessionId);
        return gate == null ? 0 : gate.pending();
    }

    // ==================== 内部 ====================

    private SessionGate gate(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("session id is required");
        }
        return gates.computeIfAbsent(sessionId, SessionGate::new);
    }

    private <T> Optional<T> lockAndRun(SessionGate gate, Supplier<T> operation) {
        try {
            gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for session " + gate.sessionId(), e);
        }
        return runAndDrain(gate, operation);
    }

    /** 重放中的操作：只释放锁，由外层继续重放 */
    private <T> Optional<T> runHeld(SessionGate gate, Supplier<T> operation) {
        try {
            return Optional.ofNullable(operation.get());
        } finally {
            gate.releaseHold();
        }
    }

    private <T> Optional<T> runAndDrain(SessionGate gate, Supplier<T> operation) {
        try {
            return Optional.ofNullable(operation.get());
        } finally {
            drain(gate);
        }
    }

    private void drain(SessionGate gate) {
        if (!gate.releaseAndStartDrain()) {
            return;
        }
        int replayed = 0;
        try {
            InboundEvent next;
            while ((next = gate.nextReady()) != null) {
                ReplayHandler handler = replayHandler;
                if (handler == null) {
                    log.warn("No replay handler registered, dropped queued event {} on session {}",
                            next.messageId(), gate.sessionId());
                    continue;
                }
                try {
                    handler.replay(next);
                    replayed++;
                } catch (RuntimeException e) {
                    log.error("Replay of event {} on session {} failed, continuing with the next one",
                            next.messageId(), gate.sessionId(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            int dropped = gate.abortDrain();
            log.warn("Drain of session {} interrupted, {} queued event(s) dropped", gate.sessionId(), dropped);
        }
        log.debug("Drained session {}: replayed={}", gate.sessionId(), replayed);
    }

    /**
     * 捕获被拦截的事件：读取所有附件，再撤回原消息。
     * 占位必须被填充，否则重放线程会一直等它。
     */
    private void intercept(SessionGate gate, QueuedEvent slot) {
        InboundEvent original = slot.original();
        List<Attachment> captured = new ArrayList<>();
        try {
            for (Attachment attachment : original.attachments()) {
                captureOne(original, attachment).ifPresent(captured::add);
            }
        } finally {
            gate.fill(slot, original.withAttachments(captured));
        }
        try {
            transport.delete(original.channelId(), original.messageId());
        } catch (RuntimeException e) {
            log.warn("Could not retract queued message {} on session {}", original.messageId(), gate.sessionId(), e);
        }
        log.info("Session {} busy, queued event {} from {} (seq={}, pending={})",
                gate.sessionId(), original.messageId(), original.authorId(), slot.sequence(), gate.pending());
    }

    private Optional<Attachment> captureOne(InboundEvent event, Attachment attachment) {
        byte[] bytes;
        try {
            bytes = transport.readAttachment(attachment);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to capture attachment {} of message {}, dropped",
                    attachment.fileName(), event.messageId(), e);
            notifyDropped(event, attachment);
            return Optional.empty();
        }
        if (bytes == null || bytes.length == 0) {
            log.warn("Captured zero bytes for attachment {} of message {}, dropped",
                    attachment.fileName(), event.messageId());
            notifyDropped(event, attachment);
            return Optional.empty();
        }
        return Optional.of(attachment.materialized(bytes));
    }

    private void notifyDropped(InboundEvent event, Attachment attachment) {
        try {
            transport.notifyUser(event.channelId(), event.authorId(),
                    String.format(DROPPED_ATTACHMENT_NOTICE, attachment.fileName()));
        } catch (RuntimeException e) {
            log.warn("Could not notify {} about dropped attachment {}", event.authorId(), attachment.fileName(), e);
        }
    }
}
