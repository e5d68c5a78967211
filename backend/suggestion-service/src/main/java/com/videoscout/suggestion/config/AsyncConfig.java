package com.videoscout.suggestion.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Configuration
@EnableAsync
@EnableScheduling
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.discovery.core-pool-size:4}")
    private int discoveryCorePoolSize;

    @Value("${async.discovery.max-pool-size:8}")
    private int discoveryMaxPoolSize;

    @Value("${async.discovery.queue-capacity:50}")
    private int discoveryQueueCapacity;

    @Value("${async.generation.core-pool-size:2}")
    private int generationCorePoolSize;

    @Value("${async.generation.max-pool-size:4}")
    private int generationMaxPoolSize;

    @Value("${async.generation.queue-capacity:20}")
    private int generationQueueCapacity;

    /**
     * 채널 업데이트/토픽 검색 병렬 실행자.
     * 요청 하나당 두 개의 작업이 제출됩니다.
     */
    @Bean(name = "discoveryExecutor")
    public AsyncTaskExecutor discoveryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(discoveryCorePoolSize);
        executor.setMaxPoolSize(discoveryMaxPoolSize);
        executor.setQueueCapacity(discoveryQueueCapacity);
        executor.setThreadNamePrefix("discovery-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from discoveryExecutor: {}", r);
            throw new RejectedExecutionException("Discovery executor saturated");
        });
        executor.initialize();
        return executor;
    }

    /**
     * 비동기 추천 생성 요청 실행자 (취소 가능한 Future 반환)
     */
    @Bean(name = "generationExecutor")
    public AsyncTaskExecutor generationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(generationCorePoolSize);
        executor.setMaxPoolSize(generationMaxPoolSize);
        executor.setQueueCapacity(generationQueueCapacity);
        executor.setThreadNamePrefix("generation-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from generationExecutor: {}", r);
            throw new RejectedExecutionException("Generation executor saturated");
        });
        executor.initialize();
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return generationExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) ->
                log.error("Uncaught async exception in method {}: {}", method.getName(), ex.getMessage(), ex);
    }
}
