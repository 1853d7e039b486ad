package com.pdfextract.backend.config;

import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import com.pdfextract.backend.services.ocr.OcrProperties;

/**
 * RestTemplate used by the REST based extraction providers. The per-call provider timeout is
 * enforced here as connect/read timeout.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, OcrProperties ocrProperties) {
        int timeoutSeconds = ocrProperties != null ? ocrProperties.getTimeoutSeconds() : 30;
        if (timeoutSeconds <= 0) timeoutSeconds = 30;

        Duration timeout = Duration.ofSeconds(timeoutSeconds);

        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
