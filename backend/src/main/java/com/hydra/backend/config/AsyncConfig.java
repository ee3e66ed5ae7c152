package com.hydra.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    @Bean(name = "strategyExecutor")
    public Executor strategyExecutor() {
        int processors = Runtime.getRuntime().availableProcessors();
        return buildExecutor("strategy-", Math.max(5, processors), Math.max(10, processors * 2), 100);
    }

    @Bean(name = "cycleExecutor")
    public Executor cycleExecutor() {
        // a single worker keeps cycles strictly sequential
        return buildExecutor("cycle-", 1, 1, 1);
    }

    @Bean(name = "priceExecutor")
    public Executor priceExecutor() {
        int processors = Runtime.getRuntime().availableProcessors();
        return buildExecutor("price-", Math.max(4, processors), Math.max(16, processors * 2), 500);
    }

    @Bean(name = "notificationExecutor")
    public Executor notificationExecutor() {
        return buildExecutor("notify-", 2, 4, 1000);
    }

    @Bean(name = "signalExecutor")
    public Executor signalExecutor() {
        return buildExecutor("signal-", 2, 8, 250);
    }

    private Executor buildExecutor(String prefix, int core, int max, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
