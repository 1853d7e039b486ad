package com.pdfextract.backend.config;

import java.util.Arrays;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Where uploads and generated artifacts live, and what uploads are accepted.
 */
@Data
@ConfigurationProperties(prefix = "pdfextract.storage")
public class StorageProperties {

    private String uploadDir = "./uploads";

    private String outputDir = "./outputs";

    private int maxUploadSizeMb = 50;

    /**
     * Comma separated, e.g. ".pdf".
     */
    private String allowedExtensions = ".pdf";

    private int maxFilesPerUpload = 20;

    public long getMaxUploadSizeBytes() {
        return (long) maxUploadSizeMb * 1024 * 1024;
    }

    public List<String> getAllowedExtensionList() {
        return Arrays.stream(allowedExtensions.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(String::toLowerCase)
                .toList();
    }
}
