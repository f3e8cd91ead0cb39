package com.example.loanmerge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class ThreadPoolConfig {

    // ==========================================
    // 1. pool 级合并线程池 (密集IO, 每个 pool 一个任务)
    // ==========================================
    @Bean("poolMergeExecutor")
    public ThreadPoolTaskExecutor poolMergeExecutor(AppProperties config) {
        return buildExecutor(config.getThreadPool().getPoolMerge(), "Pool-Merge-");
    }

    // ==========================================
    // 2. 国家级合并线程池 (每个国家一个任务)
    // ==========================================
    @Bean("countryMergeExecutor")
    public ThreadPoolTaskExecutor countryMergeExecutor(AppProperties config) {
        return buildExecutor(config.getThreadPool().getCountryMerge(), "Country-Merge-");
    }

    private ThreadPoolTaskExecutor buildExecutor(AppProperties.ThreadPool pool, String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCorePoolSize() > 0 ? pool.getCorePoolSize() : 2);
        executor.setMaxPoolSize(Math.max(pool.getMaxPoolSize(), executor.getCorePoolSize()));
        executor.setQueueCapacity(pool.getQueueCapacity());
        // 线程名前缀，方便查日志
        executor.setThreadNamePrefix(prefix);
        // 拒绝策略：由调用者所在的线程执行 (防止任务丢失)
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

}
