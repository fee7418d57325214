package com.appbuilder.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@RequiredArgsConstructor
public class BuildExecutorConfig {

    private final BuildProperties properties;

    /**
     * Runs build pipelines. The pool size is the system-wide concurrency cap;
     * further builds wait in the executor queue.
     */
    @Bean(name = "buildExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor buildExecutor() {
        int workers = Math.max(1, properties.getMaxConcurrentBuilds());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("build-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("build-scheduler-");
        scheduler.initialize();
        return scheduler;
    }
}
