package com.pdfextract.backend.dto;

import java.util.List;

import com.pdfextract.backend.enums.JobStatus;
import com.pdfextract.backend.services.extraction.DocumentExtraction;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ExtractionResultDTO {
    private String jobId;
    private JobStatus status;
    private List<DocumentExtraction> documents;
    private int totalProcessed;
    private int successful;
    private int failed;
    private String outputPath;
    private String errorMessage;
}
