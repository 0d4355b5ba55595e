package com.lelantos.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Executor;

/**
 * Analysis work blocks on the tracker pacer for minutes at a time, so it runs on its own pool instead of the
 * WebFlux event loop.
 */
@Configuration
public class AsyncConfig {

    public static final String ANALYSIS_EXECUTOR = "analysis-executor";
    public static final String ANALYSIS_SCHEDULER = "analysis-scheduler";

    @Bean(name = ANALYSIS_EXECUTOR)
    public Executor analysisExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(100);
        e.setThreadNamePrefix("analysis-");
        e.initialize();
        return e;
    }

    @Bean(name = ANALYSIS_SCHEDULER)
    public Scheduler analysisScheduler(@Qualifier(ANALYSIS_EXECUTOR) Executor analysisExecutor) {
        return Schedulers.fromExecutor(analysisExecutor);
    }
}
