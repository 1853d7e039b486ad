package com.pdfextract.backend.dto;

import java.time.LocalDateTime;

import com.pdfextract.backend.entities.ExtractionJob;
import com.pdfextract.backend.enums.JobStatus;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ExtractionStatusDTO {
    private String jobId;
    private JobStatus status;
    private double progress;
    private int filesProcessed;
    private int totalFiles;
    private String currentFile;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String errorMessage;

    public static ExtractionStatusDTO from(ExtractionJob job) {
        return ExtractionStatusDTO.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .progress(job.getProgress())
                .filesProcessed(job.getFilesProcessed())
                .totalFiles(job.getTotalFiles())
                .currentFile(job.getCurrentFile())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .errorMessage(job.getErrorMessage())
                .build();
    }
}
