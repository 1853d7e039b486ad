package com.pdfextract.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExportInfoDTO {
    private boolean available;
    private String message;
    private String jobId;
    private String filename;
    private Long fileSize;
    private String format;
    private String downloadUrl;
    private String csvDownloadUrl;
}
