package com.lelantos.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = AsyncConfig.class)
class AsyncConfigTest {

    @Autowired
    @Qualifier(AsyncConfig.ANALYSIS_EXECUTOR)
    Executor analysisExecutor;

    @Autowired
    @Qualifier(AsyncConfig.ANALYSIS_SCHEDULER)
    Scheduler analysisScheduler;

    @Test
    @DisplayName("analysis executor is created with its pool sizes")
    void executorCreated() {
        assertThat(analysisExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) analysisExecutor;
        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(8);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("analysis-");
    }

    @Test
    @DisplayName("blocking work subscribed on the analysis scheduler runs on analysis threads")
    void schedulerUsesExecutor() {
        String thread = Mono.fromCallable(() -> Thread.currentThread().getName())
                .subscribeOn(analysisScheduler)
                .block(Duration.ofSeconds(5));

        assertThat(thread).startsWith("analysis-");
    }
}
