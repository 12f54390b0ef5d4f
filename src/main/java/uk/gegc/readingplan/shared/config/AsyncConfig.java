package uk.gegc.readingplan.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.aop.interceptor.SimpleAsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for asynchronous processing.
 *
 * <p>Two pools are exposed:
 * <ul>
 *     <li>{@code planGenerationExecutor} runs deferred plan generation tasks after the creating
 *     transaction commits.</li>
 *     <li>{@code contentGeneratorExecutor} runs the remote generator call itself so the calling
 *     task can stop waiting once the generation timeout elapses.</li>
 * </ul>
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.plan-generation.core-pool-size:4}")
    private int generationCorePoolSize;

    @Value("${async.plan-generation.max-pool-size:8}")
    private int generationMaxPoolSize;

    @Value("${async.plan-generation.queue-capacity:50}")
    private int generationQueueCapacity;

    @Value("${async.plan-generation.keep-alive-seconds:60}")
    private int generationKeepAliveSeconds;

    @Value("${async.content-generator.core-pool-size:4}")
    private int generatorCorePoolSize;

    @Value("${async.content-generator.max-pool-size:8}")
    private int generatorMaxPoolSize;

    @Value("${async.content-generator.queue-capacity:50}")
    private int generatorQueueCapacity;

    @Bean(name = "planGenerationExecutor")
    public ThreadPoolTaskExecutor planGenerationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(generationCorePoolSize);
        executor.setMaxPoolSize(generationMaxPoolSize);
        executor.setQueueCapacity(generationQueueCapacity);
        executor.setKeepAliveSeconds(generationKeepAliveSeconds);
        executor.setThreadNamePrefix("plan-gen-");
        // Caller runs the task if queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Plan generation executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                generationCorePoolSize, generationMaxPoolSize, generationQueueCapacity, generationKeepAliveSeconds);
        return executor;
    }

    @Bean(name = "contentGeneratorExecutor")
    public ThreadPoolTaskExecutor contentGeneratorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(generatorCorePoolSize);
        executor.setMaxPoolSize(generatorMaxPoolSize);
        executor.setQueueCapacity(generatorQueueCapacity);
        executor.setThreadNamePrefix("content-gen-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("Content generator executor configured - Core: {}, Max: {}, Queue: {}",
                generatorCorePoolSize, generatorMaxPoolSize, generatorQueueCapacity);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return planGenerationExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new SimpleAsyncUncaughtExceptionHandler() {
            @Override
            public void handleUncaughtException(Throwable ex, java.lang.reflect.Method method, Object... params) {
                log.error("Uncaught exception in async method: {}.{}() with parameters: {}",
                        method.getDeclaringClass().getSimpleName(),
                        method.getName(),
                        java.util.Arrays.toString(params), ex);
                super.handleUncaughtException(ex, method, params);
            }
        };
    }
}
