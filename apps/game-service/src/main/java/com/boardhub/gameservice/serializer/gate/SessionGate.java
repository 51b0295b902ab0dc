package com.boardhub.gameservice.serializer.gate;

import com.boardhub.gameservice.serializer.event.InboundEvent;
import com.boardhub.gameservice.serializer.event.QueuedEvent;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 单个会话的锁与重放队列。
 * 所有字段都由本对象的监视器保护；附件读取等 I/O 不在监视器内进行。
 */
final class SessionGate {

    private final String sessionId;
    private boolean held;
    private Thread owner;
    /** 正在重放队列（防止递归重放） */
    private boolean draining;
    private Thread drainer;
    private long arrivals;
    private final Deque<QueuedEvent> queue = new ArrayDeque<>();

    SessionGate(String sessionId) {
        this.sessionId = sessionId;
    }

    String sessionId() {
        return sessionId;
    }

    synchronized boolean isBusy() {
        return held || draining || !queue.isEmpty();
    }

    synchronized int pending() {
        return queue.size();
    }

    synchronized boolean heldByCurrentThread() {
        return held && owner == Thread.currentThread();
    }

    /** 当前线程正在重放本会话的队列 */
    synchronized boolean drainingOnCurrentThread() {
        return draining && drainer == Thread.currentThread();
    }

    /** 空闲则占用并返回 true；忙则返回 false */
    synchronized boolean tryAcquire() {
        if (isBusy()) return false;
        take();
        return true;
    }

    /** 忙则在队尾占位（保持到达顺序），返回占位；空闲则直接占用并返回 null */
    synchronized QueuedEvent acquireOrReserve(InboundEvent event) {
        if (!isBusy()) {
            take();
            return null;
        }
        QueuedEvent slot = new QueuedEvent(++arrivals, event, Instant.now());
        queue.addLast(slot);
        return slot;
    }

    /** 等待空闲后占用 */
    synchronized void acquire() throws InterruptedException {
        while (isBusy()) {
            wait();
        }
        take();
    }

    /** 重放线程为重放事件重新申请锁（队列仍可能非空） */
    synchronized void acquireForReplay() {
        take();
    }

    synchronized void fill(QueuedEvent slot, InboundEvent captured) {
        slot.fill(captured);
        notifyAll();
    }

    synchronized void releaseHold() {
        held = false;
        owner = null;
        notifyAll();
    }

    /**
     * 释放锁并尝试成为重放者。
     * @return true 表示当前线程成为重放者，应调用 {@link #nextReady()} 逐个重放
     */
    synchronized boolean releaseAndStartDrain() {
        held = false;
        owner = null;
        if (draining || queue.isEmpty()) {
            notifyAll();
            return false;
        }
        draining = true;
        drainer = Thread.currentThread();
        return true;
    }

    /**
     * 取出队首（等待其附件读取完成）；队列已空则结束重放并返回 null。
     */
    synchronized InboundEvent nextReady() throws InterruptedException {
        while (true) {
            QueuedEvent head = queue.peekFirst();
            if (head == null) {
                draining = false;
                drainer = null;
                notifyAll();
                return null;
            }
            if (head.isReady()) {
                queue.removeFirst();
                return head.captured();
            }
            wait();
        }
    }

    /** 重放线程被中断：放弃剩余事件 */
    synchronized int abortDrain() {
        int dropped = queue.size();
        queue.clear();
        draining = false;
        drainer = null;
        notifyAll();
        return dropped;
    }

    private void take() {
        held = true;
        owner = Thread.currentThread();
    }
}
