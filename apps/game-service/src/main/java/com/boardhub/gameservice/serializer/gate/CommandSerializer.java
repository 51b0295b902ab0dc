package com.boardhub.gameservice.serializer.gate;

import com.boardhub.gameservice.serializer.event.InboundEvent;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * CommandSerializer
 * ---------------------------------------
 * 按会话的“咨询锁 + 拦截/排队/重放”协议，与具体游戏无关。
 *
 * 约定：
 *  - 同一会话同一时刻最多一个变更操作在执行；
 *  - 会话忙时到达的事件：读取完整内容（文本、附件、回复引用）后从频道撤回原消息，
 *    按到达顺序排队，立即返回；
 *  - 操作结束（无论成功或异常）后按到达顺序重放，重放事件带 replayed 标记，不会被再次排队或撤回；
 *  - 同一线程在持锁期间再次申请同一会话的锁：跳过并记录为丢弃事件。
 */
public interface CommandSerializer {

    /**
     * ReplayHandler
     * ---------------------------------------
     * 重放入口，一般就是正常的分发入口（调用方应以 replayed=true 再次调用 {@link #submit}）。
     */
    interface ReplayHandler {
        /**
         * @param event 捕获时的完整事件（附件已读取）
         */
        void replay(InboundEvent event);
    }

    void setReplayHandler(ReplayHandler handler);

    /**
     * 入站事件入口。
     * @param event     入站事件，channelId 即会话 id
     * @param replayed  是否为重放事件
     * @param operation 获得锁后执行的操作
     * @return 操作结果；事件被排队或被丢弃时返回 empty
     */
    <T> Optional<T> submit(InboundEvent event, boolean replayed, Supplier<T> operation);

    /**
     * 无入站事件的操作（如 HTTP 查询）：等待会话空闲后执行。
     * 同线程重入时跳过并返回 empty。
     */
    <T> Optional<T> withLock(String sessionId, Supplier<T> operation);

    /**
     * 尽力而为的后台操作（如定时自动存档）：会话忙则直接跳过。
     */
    <T> Optional<T> tryWithLock(String sessionId, Supplier<T> operation);

    boolean isBusy(String sessionId);

    /** 当前排队中的事件数 */
    int pendingCount(String sessionId);
}
