package com.cecil.assembler.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TaskExecutorConfig {

    @Value("${assembler.executor.core-pool-size:4}")
    private int corePoolSize;
    @Value("${assembler.executor.max-pool-size:8}")
    private int maxPoolSize;
    @Value("${assembler.executor.queue-capacity:100}")
    private int queueCapacity;

    @Bean("rasterLoadExecutor")
    public TaskExecutor rasterLoadExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity); // overflow runs on the assembling thread
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("RasterLoad-");
        executor.initialize();
        return executor;
    }
}
