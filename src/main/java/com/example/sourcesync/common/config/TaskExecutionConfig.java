package com.example.sourcesync.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private ExecutorService syncTaskExecutor;

    @Bean
    public ExecutorService syncTaskExecutor(AppSyncProperties appSyncProperties) {
        int core = Math.max(1, appSyncProperties.getListThreadCount());
        int queueSize = Math.max(20, appSyncProperties.getListQueueCapacity());
        this.syncTaskExecutor = new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueSize),
                new NamedThreadFactory("sync-list-"),
                new ThreadPoolExecutor.CallerRunsPolicy());
        return this.syncTaskExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (syncTaskExecutor != null) {
            syncTaskExecutor.shutdown();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
