package com.boardhub.gameservice.games.board.application;

import com.boardhub.gameservice.games.board.service.BoardGameService;
import com.boardhub.gameservice.serializer.gate.CommandSerializer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * AutosaveCoordinator
 * -------------------------------------------------
 * 周期性地为所有进行中的会话写自动存档。
 * - 只在会话空闲时存档（tryWithLock），忙则跳到下一个周期；
 * - 失败只记日志，不影响游戏。
 */
@Slf4j
@Component
public class AutosaveCoordinator {

    private final BoardGameService service;
    private final CommandSerializer serializer;
    private final ScheduledThreadPoolExecutor scheduler;
    private final long intervalSeconds;

    public AutosaveCoordinator(BoardGameService service,
                               CommandSerializer serializer,
                               @Qualifier("autosaveScheduler") ScheduledThreadPoolExecutor scheduler,
                               @Value("${boardhub.persistence.autosave-interval-seconds:300}") long intervalSeconds) {
        this.service = service;
        this.serializer = serializer;
        this.scheduler = scheduler;
        this.intervalSeconds = intervalSeconds;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (intervalSeconds <= 0) {
            log.info("Periodic autosave disabled");
            return;
        }
        scheduler.scheduleWithFixedDelay(this::saveAll, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.info("Periodic autosave scheduled every {}s", intervalSeconds);
    }

    /** 返回本轮实际写入的存档数 */
    int saveAll() {
        int saved = 0;
        for (String sessionId : service.activeSessionIds()) {
            try {
                if (serializer.tryWithLock(sessionId, () -> service.autosave(sessionId).orElse(null)).isPresent()) {
                    saved++;
                }
            } catch (RuntimeException e) {
                log.warn("Periodic autosave of session {} failed", sessionId, e);
            }
        }
        log.debug("Periodic autosave done: saved={}", saved);
        return saved;
    }
}
