package com.makeithappen.backend.config;

import com.makeithappen.backend.daily.config.DailyScheduleProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncSchedulingConfig {

    /** Shared by every fresh-action batch; the per-batch semaphore still caps each request. */
    @Bean("actionGenerationExecutor")
    public TaskExecutor actionGenerationExecutor(DailyScheduleProperties props) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(props.aiMaxConcurrency());
        ex.setMaxPoolSize(props.aiMaxConcurrency() * 2);
        ex.setQueueCapacity(500);
        ex.setThreadNamePrefix("action-gen-");
        ex.initialize();
        return ex;
    }
}
