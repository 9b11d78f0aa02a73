package com.newsrelay.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
@EnableScheduling
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${relay.executor.relay.core-pool-size:2}")
    private int relayCorePoolSize;

    @Value("${relay.executor.relay.max-pool-size:4}")
    private int relayMaxPoolSize;

    @Value("${relay.executor.relay.queue-capacity:200}")
    private int relayQueueCapacity;

    @Value("${relay.executor.publish.core-pool-size:4}")
    private int publishCorePoolSize;

    @Value("${relay.executor.publish.max-pool-size:8}")
    private int publishMaxPoolSize;

    @Value("${relay.executor.publish.queue-capacity:100}")
    private int publishQueueCapacity;

    /**
     * Runs one rewrite-and-fanout pipeline per claimed item, off the request thread
     */
    @Bean(name = "relayExecutor")
    public ThreadPoolTaskExecutor relayExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(relayCorePoolSize);
        executor.setMaxPoolSize(relayMaxPoolSize);
        executor.setQueueCapacity(relayQueueCapacity);
        executor.setThreadNamePrefix("relay-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        executor.initialize();
        return executor;
    }

    /**
     * One task per destination post
     */
    @Bean(name = "publishExecutor")
    public ThreadPoolTaskExecutor publishExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(publishCorePoolSize);
        executor.setMaxPoolSize(publishMaxPoolSize);
        executor.setQueueCapacity(publishQueueCapacity);
        executor.setThreadNamePrefix("publish-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return relayExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) ->
                log.error("Uncaught async exception in method {}: {}", method.getName(), ex.getMessage(), ex);
    }
}
