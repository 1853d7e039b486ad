package com.pdfextract.backend.dto;

import java.time.LocalDateTime;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ExportFileDTO {
    private String filename;
    private String jobId;
    private long fileSize;
    private LocalDateTime createdAt;
    private String downloadUrl;
}
