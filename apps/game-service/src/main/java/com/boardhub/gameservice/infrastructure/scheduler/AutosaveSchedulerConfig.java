package com.boardhub.gameservice.infrastructure.scheduler;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 定时自动存档专用线程池，与 STOMP 入站线程分开，存档慢不会拖住命令处理。
 */
@Configuration
public class AutosaveSchedulerConfig {

    @Bean(name = "autosaveScheduler", destroyMethod = "shutdown")
    public ScheduledThreadPoolExecutor autosaveScheduler() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "autosave-" + seq.getAndIncrement());
                // 非业务线程，JVM 退出时不用等它
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(1, tf, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
