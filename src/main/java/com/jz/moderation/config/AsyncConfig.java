package com.jz.moderation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AsyncConfig {

    /** 验证码超时、延迟欢迎、欢迎语自动删除共用的定时线程池（守护线程） */
    @Bean(name = "moderationScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService moderationScheduler() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "moderation-timer-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
