package com.pdfextract.backend.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    public static final String EXTRACTION_EXECUTOR = "extractionTaskExecutor";

    @Bean(name = EXTRACTION_EXECUTOR)
    public Executor extractionTaskExecutor(JobProperties jobProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, jobProperties.getCorePoolSize()));
        executor.setMaxPoolSize(Math.max(jobProperties.getCorePoolSize(), jobProperties.getMaxPoolSize()));
        executor.setQueueCapacity(Math.max(0, jobProperties.getQueueCapacity()));
        executor.setThreadNamePrefix("extraction-job-");
        executor.initialize();
        return executor;
    }
}
