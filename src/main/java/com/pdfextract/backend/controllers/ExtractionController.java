package com.pdfextract.backend.controllers;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.pdfextract.backend.dto.ApiResponse;
import com.pdfextract.backend.dto.ExtractionRequestDTO;
import com.pdfextract.backend.dto.ExtractionResultDTO;
import com.pdfextract.backend.dto.ExtractionStatusDTO;
import com.pdfextract.backend.entities.ExtractionJob;
import com.pdfextract.backend.services.ExtractionJobService;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/extract")
@RequiredArgsConstructor
@Tag(name = "extraction")
public class ExtractionController {

    private final ExtractionJobService jobService;

    @PostMapping("/start")
    public ResponseEntity<ApiResponse<ExtractionStatusDTO>> start(@Valid @RequestBody ExtractionRequestDTO request) {
        ExtractionJob job = jobService.submit(
                request.getFileIds(),
                request.getDocumentType(),
                request.getCustomFields(),
                request.isConsolidate()
        );
        return ResponseEntity.accepted().body(ApiResponse.success(ExtractionStatusDTO.from(job), "Extraction job started"));
    }

    @GetMapping("/status/{jobId}")
    public ResponseEntity<ApiResponse<ExtractionStatusDTO>> status(@PathVariable String jobId) {
        return ResponseEntity.ok(ApiResponse.success(ExtractionStatusDTO.from(jobService.getStatus(jobId)), "Job status"));
    }

    @GetMapping("/result/{jobId}")
    public ResponseEntity<ApiResponse<ExtractionResultDTO>> result(@PathVariable String jobId) {
        return ResponseEntity.ok(ApiResponse.success(jobService.getResult(jobId), "Job result"));
    }

    @GetMapping("/jobs")
    public ResponseEntity<ApiResponse<List<ExtractionStatusDTO>>> jobs() {
        List<ExtractionStatusDTO> jobs = jobService.listJobs().stream().map(ExtractionStatusDTO::from).toList();
        return ResponseEntity.ok(ApiResponse.success(jobs, jobs.size() + " job(s)"));
    }

    @DeleteMapping("/{jobId}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String jobId) {
        jobService.delete(jobId);
        return ResponseEntity.ok(ApiResponse.done("Job deleted successfully"));
    }
}
