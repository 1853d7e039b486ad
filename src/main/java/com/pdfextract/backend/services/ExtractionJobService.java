package com.pdfextract.backend.services;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.pdfextract.backend.config.AsyncExecutorConfig;
import com.pdfextract.backend.config.JobProperties;
import com.pdfextract.backend.dto.ExtractionResultDTO;
import com.pdfextract.backend.entities.ExtractionJob;
import com.pdfextract.backend.enums.DocumentType;
import com.pdfextract.backend.enums.JobStatus;
import com.pdfextract.backend.exceptions.BadRequestException;
import com.pdfextract.backend.exceptions.ConflictException;
import com.pdfextract.backend.exceptions.ResourceNotFoundException;
import com.pdfextract.backend.repositories.JobStore;
import com.pdfextract.backend.services.consolidation.ConsolidatedTable;
import com.pdfextract.backend.services.consolidation.Consolidator;
import com.pdfextract.backend.services.consolidation.SummaryStatistics;
import com.pdfextract.backend.services.export.ExportService;
import com.pdfextract.backend.services.export.SpreadsheetGenerator;
import com.pdfextract.backend.services.extraction.DocumentExtraction;
import com.pdfextract.backend.services.extraction.DocumentExtractor;
import com.pdfextract.backend.services.extraction.DocumentOutcome;
import com.pdfextract.backend.services.upload.UploadStorageService;
import com.pdfextract.backend.services.upload.UploadedFile;

import lombok.extern.slf4j.Slf4j;

/**
 * Owns the extraction job lifecycle: submission, the sequential per-file loop, consolidation and
 * clean-up. Files of one job are processed one at a time; separate jobs run on the extraction executor.
 */
@Service
@Slf4j
public class ExtractionJobService {

    private static final DateTimeFormatter JOB_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final int MAX_ERROR_LENGTH = 2000;

    private final JobStore jobStore;
    private final UploadStorageService uploadStorageService;
    private final DocumentExtractor documentExtractor;
    private final Consolidator consolidator;
    private final SpreadsheetGenerator spreadsheetGenerator;
    private final ExportService exportService;
    private final JobProperties jobProperties;
    private final Executor executor;

    public ExtractionJobService(JobStore jobStore,
                                UploadStorageService uploadStorageService,
                                DocumentExtractor documentExtractor,
                                Consolidator consolidator,
                                SpreadsheetGenerator spreadsheetGenerator,
                                ExportService exportService,
                                JobProperties jobProperties,
                                @Qualifier(AsyncExecutorConfig.EXTRACTION_EXECUTOR) Executor executor) {
        this.jobStore = jobStore;
        this.uploadStorageService = uploadStorageService;
        this.documentExtractor = documentExtractor;
        this.consolidator = consolidator;
        this.spreadsheetGenerator = spreadsheetGenerator;
        this.exportService = exportService;
        this.jobProperties = jobProperties;
        this.executor = executor;
    }

    /**
     * Validates the request, stores a Pending job and hands processing to the executor.
     *
     * @return the job as it was stored, before any processing
     */
    public ExtractionJob submit(List<String> fileIds, DocumentType documentType,
                                List<String> customFields, boolean consolidate) {
        if (fileIds == null || fileIds.isEmpty()) {
            throw new BadRequestException("No file IDs provided");
        }
        if (fileIds.size() > jobProperties.getMaxFilesPerJob()) {
            throw new BadRequestException("Too many files. Maximum " + jobProperties.getMaxFilesPerJob() + " files per job.");
        }

        List<UploadedFile> files = new ArrayList<>(fileIds.size());
        for (String fileId : fileIds) {
            files.add(uploadStorageService.resolve(fileId));
        }

        ExtractionJob job = new ExtractionJob();
        job.setId(newJobId());
        job.setStatus(JobStatus.PENDING);
        job.setTotalFiles(files.size());
        job.setStartedAt(LocalDateTime.now());
        job.setFileIds(new ArrayList<>(fileIds));
        job.setDocumentType(documentType == null ? DocumentType.INVOICE : documentType);
        job.setCustomFields(customFields == null ? new ArrayList<>() : new ArrayList<>(customFields));
        job.setConsolidate(consolidate);

        ExtractionJob created = jobStore.create(job);
        log.info("[ExtractionJob] Created jobId={} files={} documentType={} consolidate={}",
                created.getId(), files.size(), created.getDocumentType().getValue(), consolidate);

        try {
            executor.execute(() -> processJob(created.getId(), files));
        } catch (RejectedExecutionException e) {
            log.error("[ExtractionJob] Executor rejected jobId={}", created.getId(), e);
            update(created.getId(), j -> {
                j.setStatus(JobStatus.FAILED);
                j.setErrorMessage("Job could not be scheduled: " + e.getMessage());
                j.setCompletedAt(LocalDateTime.now());
            });
            return getStatus(created.getId());
        }
        return created;
    }

    public ExtractionJob getStatus(String jobId) {
        return jobStore.get(jobId).orElseThrow(() -> new ResourceNotFoundException("Job not found: " + jobId));
    }

    public List<ExtractionJob> listJobs() {
        List<ExtractionJob> jobs = new ArrayList<>();
        for (String id : jobStore.listIds()) {
            jobStore.get(id).ifPresent(jobs::add);
        }
        jobs.sort((a, b) -> b.getStartedAt().compareTo(a.getStartedAt()));
        return jobs;
    }

    public ExtractionResultDTO getResult(String jobId) {
        ExtractionJob job = getStatus(jobId);
        if (!job.getStatus().isTerminal()) {
            throw new ConflictException("Job not completed. Current status: " + job.getStatus().getValue());
        }

        List<DocumentExtraction> documents = job.getDocuments();
        int successful = (int) documents.stream().filter(DocumentExtraction::success).count();
        return ExtractionResultDTO.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .documents(documents)
                .totalProcessed(documents.size())
                .successful(successful)
                .failed(documents.size() - successful)
                .outputPath(job.getOutputPath())
                .errorMessage(job.getErrorMessage())
                .build();
    }

    public void delete(String jobId) {
        ExtractionJob job = getStatus(jobId);
        exportService.deleteArtifacts(job.getOutputPath());
        jobStore.delete(jobId);
        log.info("[ExtractionJob] Deleted jobId={}", jobId);
    }

    void processJob(String jobId, List<UploadedFile> files) {
        long startMs = System.currentTimeMillis();
        try {
            ExtractionJob job = jobStore.get(jobId).orElse(null);
            if (job == null || !update(jobId, j -> j.setStatus(JobStatus.PROCESSING))) return;

            int total = files.size();
            for (int i = 0; i < total; i++) {
                UploadedFile file = files.get(i);
                if (!update(jobId, j -> j.setCurrentFile(file.filename()))) return;
                log.info("[ExtractionJob] jobId={} processing file {}/{}: {}", jobId, i + 1, total, file.filename());

                DocumentExtraction document = toExtraction(documentExtractor.extract(
                        file.fileId(), file.filename(), file.path(), job.getDocumentType(), job.getCustomFields()),
                        file, job.getDocumentType());

                int processed = i + 1;
                double progress = processed * 100.0 / total;
                boolean stillThere = update(jobId, j -> {
                    j.addDocument(document);
                    j.setFilesProcessed(processed);
                    j.setProgress(Math.max(j.getProgress(), progress));
                });
                if (!stillThere) return;

                if (processed < total) {
                    pauseBetweenFiles();
                }
            }

            List<DocumentExtraction> documents = getStatus(jobId).getDocuments();
            String outputPath = null;
            String stageError = null;
            if (job.isConsolidate() && documents.stream().anyMatch(DocumentExtraction::success)) {
                try {
                    outputPath = consolidateAndExport(jobId, documents);
                } catch (RuntimeException e) {
                    log.error("[ExtractionJob] Consolidation failed jobId={}: {}", jobId, e.toString());
                    stageError = "Consolidation failed: " + e.getMessage();
                }
            }

            String finalOutput = outputPath;
            String finalError = stageError;
            boolean recorded = update(jobId, j -> {
                j.setStatus(JobStatus.COMPLETED);
                j.setProgress(100);
                j.setFilesProcessed(j.getTotalFiles());
                j.setCurrentFile(null);
                j.setOutputPath(finalOutput);
                j.setErrorMessage(trimError(finalError));
                j.setCompletedAt(LocalDateTime.now());
            });
            if (!recorded) {
                // deleted while the workbook was being written
                exportService.deleteArtifacts(finalOutput);
                return;
            }
            log.info("[ExtractionJob] Completed jobId={} files={} elapsedMs={}", jobId, total, System.currentTimeMillis() - startMs);
        } catch (RuntimeException e) {
            log.error("[ExtractionJob] failed jobId={}", jobId, e);
            String message = trimError(e.getMessage() != null ? e.getMessage() : e.toString());
            update(jobId, j -> {
                for (int k = j.getDocuments().size(); k < files.size(); k++) {
                    UploadedFile file = files.get(k);
                    j.addDocument(DocumentExtraction.failed(file.fileId(), file.filename(), j.getDocumentType(), message));
                }
                j.setFilesProcessed(j.getTotalFiles());
                j.setStatus(JobStatus.FAILED);
                j.setCurrentFile(null);
                j.setErrorMessage(message);
                j.setCompletedAt(LocalDateTime.now());
            });
        }
    }

    private String consolidateAndExport(String jobId, List<DocumentExtraction> documents) {
        log.info("[ExtractionJob] Consolidating {} extractions jobId={}", documents.size(), jobId);
        ConsolidatedTable table = consolidator.consolidate(documents);
        if (table.isEmpty()) {
            log.warn("[ExtractionJob] No data to consolidate jobId={}", jobId);
            return null;
        }
        SummaryStatistics summary = consolidator.summarize(table);
        Path output = spreadsheetGenerator.generate(table, jobId + "_results", true, summary);
        return output.toString();
    }

    private static DocumentExtraction toExtraction(DocumentOutcome outcome, UploadedFile file, DocumentType requested) {
        if (outcome instanceof DocumentOutcome.Extracted extracted) {
            return extracted.extraction();
        }
        String reason = ((DocumentOutcome.Rejected) outcome).reason();
        return DocumentExtraction.failed(file.fileId(), file.filename(), requested, trimError(reason));
    }

    private boolean update(String jobId, Consumer<ExtractionJob> mutation) {
        boolean present = jobStore.update(jobId, mutation).isPresent();
        if (!present) {
            log.warn("[ExtractionJob] jobId={} was deleted while running; stopping", jobId);
        }
        return present;
    }

    private void pauseBetweenFiles() {
        long delay = jobProperties.getInterFileDelayMs();
        if (delay <= 0) return;
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    static String newJobId() {
        return "job_" + LocalDateTime.now().format(JOB_ID_TIME) + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static String trimError(String message) {
        if (message == null) return null;
        String m = message.trim();
        if (m.length() <= MAX_ERROR_LENGTH) return m;
        return m.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
