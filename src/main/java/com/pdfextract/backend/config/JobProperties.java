package com.pdfextract.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

@Data
@ConfigurationProperties(prefix = "pdfextract.jobs")
public class JobProperties {

    private int maxFilesPerJob = 20;

    /**
     * Pause between two files of the same job. Provider rate-limit safeguard only.
     */
    private long interFileDelayMs = 100;

    private int corePoolSize = 2;

    private int maxPoolSize = 4;

    private int queueCapacity = 100;
}
