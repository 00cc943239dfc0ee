package com.roomchat.server.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool that writes queued events to sockets, outside the RoomManager lock.
 * No task queue: a send stuck on one socket holds only its own thread while others start new ones.
 */
@Configuration
public class OutboundConfig {

    @Bean(name = "outboundExecutor")
    public ThreadPoolTaskExecutor outboundExecutor(@Value("${roomchat.outbox.threads:4}") int threads,
                                                   @Value("${roomchat.outbox.max-threads:64}") int maxThreads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(Math.max(threads, maxThreads));
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("ws-outbound-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
