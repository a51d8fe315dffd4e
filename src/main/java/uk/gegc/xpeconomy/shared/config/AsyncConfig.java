package uk.gegc.xpeconomy.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Arrays;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for work that runs after a ledger transaction has committed
 * (velocity checks, review flagging) and for quiz grading hand-offs.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.monitoring.core-pool-size:2}")
    private int monitoringCorePoolSize;

    @Value("${async.monitoring.max-pool-size:4}")
    private int monitoringMaxPoolSize;

    @Value("${async.monitoring.queue-capacity:100}")
    private int monitoringQueueCapacity;

    @Value("${async.monitoring.keep-alive-seconds:60}")
    private int monitoringKeepAliveSeconds;

    @Bean(name = "monitoringTaskExecutor")
    public Executor monitoringTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(monitoringCorePoolSize);
        executor.setMaxPoolSize(monitoringMaxPoolSize);
        executor.setQueueCapacity(monitoringQueueCapacity);
        executor.setKeepAliveSeconds(monitoringKeepAliveSeconds);
        executor.setThreadNamePrefix("xp-monitor-");
        // a full queue degrades to inline checks rather than dropping them
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Monitoring Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                monitoringCorePoolSize, monitoringMaxPoolSize, monitoringQueueCapacity, monitoringKeepAliveSeconds);

        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return monitoringTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) -> log.error("Uncaught exception in async method: {}.{}() with parameters: {}",
                method.getDeclaringClass().getSimpleName(),
                method.getName(),
                Arrays.toString(params), ex);
    }
}
