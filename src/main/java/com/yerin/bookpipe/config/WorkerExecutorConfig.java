package com.yerin.bookpipe.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Threads that actually run stage bodies, so a worker can stop waiting on a stage that
 * overruns its timeout. One per worker plus headroom for abandoned stages still unwinding.
 */
@Configuration
public class WorkerExecutorConfig {

    @Bean(name = "stageExecutor")
    public ThreadPoolTaskExecutor stageExecutor(BookpipeProperties properties) {
        int workers = properties.getWorker().getConcurrency();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers * 2);
        executor.setQueueCapacity(workers);
        executor.setThreadNamePrefix("stage-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
