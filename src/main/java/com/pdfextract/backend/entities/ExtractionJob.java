package com.pdfextract.backend.entities;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import com.pdfextract.backend.enums.DocumentType;
import com.pdfextract.backend.enums.JobStatus;
import com.pdfextract.backend.services.extraction.DocumentExtraction;

import lombok.Getter;
import lombok.Setter;

/**
 * Mutable job record owned by the job store. Callers outside the store only ever see {@link #copy()}s.
 */
@Getter
@Setter
public class ExtractionJob {

    private String id;

    private JobStatus status = JobStatus.PENDING;

    private double progress;

    private int filesProcessed;

    private int totalFiles;

    private String currentFile;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private String errorMessage;

    private List<DocumentExtraction> documents = new ArrayList<>();

    private String outputPath;

    private List<String> fileIds = new ArrayList<>();

    private DocumentType documentType = DocumentType.INVOICE;

    private List<String> customFields = new ArrayList<>();

    private boolean consolidate = true;

    public void addDocument(DocumentExtraction document) {
        documents.add(document);
    }

    public ExtractionJob copy() {
        ExtractionJob copy = new ExtractionJob();
        copy.id = id;
        copy.status = status;
        copy.progress = progress;
        copy.filesProcessed = filesProcessed;
        copy.totalFiles = totalFiles;
        copy.currentFile = currentFile;
        copy.startedAt = startedAt;
        copy.completedAt = completedAt;
        copy.errorMessage = errorMessage;
        copy.documents = new ArrayList<>(documents);
        copy.outputPath = outputPath;
        copy.fileIds = new ArrayList<>(fileIds);
        copy.documentType = documentType;
        copy.customFields = new ArrayList<>(customFields);
        copy.consolidate = consolidate;
        return copy;
    }
}
